package com.glimpse.ui;

import com.glimpse.core.image.ResampleFilter;
import com.glimpse.core.ops.Op;

import javax.swing.*;
import java.awt.*;
import java.util.Optional;

/**
 * Modal prompt for a new image size. Width and height stay in proportion while the aspect lock
 * is on.
 */
final class ResizeDialog {

    private static final int MAX_SIDE = 65_535;

    private final int originalWidth;
    private final int originalHeight;
    private final JSpinner widthSpinner;
    private final JSpinner heightSpinner;
    private final JCheckBox keepAspect = new JCheckBox("Keep aspect ratio", true);
    private final JComboBox<ResampleFilter> filterBox = new JComboBox<>(ResampleFilter.values());
    private boolean syncing;

    ResizeDialog(int width, int height, ResampleFilter defaultFilter) {
        this.originalWidth = width;
        this.originalHeight = height;
        this.widthSpinner = new JSpinner(new SpinnerNumberModel(width, 1, MAX_SIDE, 1));
        this.heightSpinner = new JSpinner(new SpinnerNumberModel(height, 1, MAX_SIDE, 1));
        filterBox.setSelectedItem(defaultFilter);
        widthSpinner.addChangeListener(e -> follow(widthSpinner, heightSpinner, (double) originalHeight / originalWidth));
        heightSpinner.addChangeListener(e -> follow(heightSpinner, widthSpinner, (double) originalWidth / originalHeight));
    }

    /** Shows the dialog; empty when cancelled or nothing would change. */
    Optional<Op.Resize> prompt(Component parent) {
        JPanel form = new JPanel(new GridLayout(0, 2, 8, 6));
        form.add(new JLabel("Width:"));
        form.add(widthSpinner);
        form.add(new JLabel("Height:"));
        form.add(heightSpinner);
        form.add(new JLabel("Filter:"));
        form.add(filterBox);
        form.add(keepAspect);
        form.add(new JLabel("Original: " + originalWidth + " × " + originalHeight));

        int choice = JOptionPane.showConfirmDialog(parent, form, "Resize Image",
            JOptionPane.OK_CANCEL_OPTION, JOptionPane.PLAIN_MESSAGE);
        if (choice != JOptionPane.OK_OPTION) {
            return Optional.empty();
        }
        int width = (Integer) widthSpinner.getValue();
        int height = (Integer) heightSpinner.getValue();
        if (width == originalWidth && height == originalHeight) {
            return Optional.empty();
        }
        return Optional.of(new Op.Resize(width, height, (ResampleFilter) filterBox.getSelectedItem()));
    }

    private void follow(JSpinner source, JSpinner target, double ratio) {
        if (syncing || !keepAspect.isSelected()) {
            return;
        }
        syncing = true;
        try {
            int value = (Integer) source.getValue();
            target.setValue(Math.max(1, Math.min(MAX_SIDE, (int) Math.round(value * ratio))));
        } finally {
            syncing = false;
        }
    }
}
