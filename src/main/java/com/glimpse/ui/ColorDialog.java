package com.glimpse.ui;

import com.glimpse.core.document.ImageDocument;
import com.glimpse.core.image.ColorAdjustment;

import javax.swing.*;
import java.awt.*;
import java.util.Optional;

/**
 * Hue, contrast, saturation and lightness sliders. Slider moves are kept as the document's
 * pending adjustment; confirming returns it for the worker to bake in.
 */
final class ColorDialog {

    private final JSlider hue = slider(-180, 180);
    private final JSlider contrast = slider(-100, 100);
    private final JSlider saturation = slider(-100, 100);
    private final JSlider lightness = slider(-100, 100);

    Optional<ColorAdjustment> prompt(Component parent, ImageDocument document) {
        ColorAdjustment start = document.pendingColor();
        hue.setValue(Math.round(start.hue()));
        contrast.setValue(Math.round(start.contrast()));
        saturation.setValue(Math.round(start.saturation()));
        lightness.setValue(Math.round(start.lightness()));
        for (JSlider slider : new JSlider[]{hue, contrast, saturation, lightness}) {
            slider.addChangeListener(e -> document.setPendingColor(current()));
        }

        JPanel form = new JPanel(new GridLayout(0, 2, 8, 6));
        form.add(new JLabel("Hue:"));
        form.add(hue);
        form.add(new JLabel("Contrast:"));
        form.add(contrast);
        form.add(new JLabel("Saturation:"));
        form.add(saturation);
        form.add(new JLabel("Lightness:"));
        form.add(lightness);

        int choice = JOptionPane.showConfirmDialog(parent, form, "Adjust Colors",
            JOptionPane.OK_CANCEL_OPTION, JOptionPane.PLAIN_MESSAGE);
        if (choice != JOptionPane.OK_OPTION) {
            document.resetPendingColor();
            return Optional.empty();
        }
        ColorAdjustment chosen = current();
        return chosen.isNeutral() ? Optional.empty() : Optional.of(chosen);
    }

    private ColorAdjustment current() {
        return new ColorAdjustment(hue.getValue(), contrast.getValue(), saturation.getValue(), lightness.getValue());
    }

    private static JSlider slider(int min, int max) {
        JSlider slider = new JSlider(min, max, 0);
        slider.setMajorTickSpacing((max - min) / 4);
        slider.setPaintTicks(true);
        return slider;
    }
}
