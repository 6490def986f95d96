package com.glimpse.ui;

import com.glimpse.core.document.CropGesture;
import com.glimpse.core.document.ImageDocument;
import com.glimpse.core.session.EditorSession;

import javax.swing.*;
import java.awt.*;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.event.MouseWheelEvent;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * Paints the open document at its zoom, position and rotation, and turns mouse input into pan,
 * zoom and crop-selection gestures.
 */
final class ImageCanvas extends JComponent {

    private static final Color BACKGROUND = new Color(0x2b2b2b);
    private static final Color SELECTION_FILL = new Color(255, 255, 255, 48);

    private final EditorSession session;
    private final Runnable onCropSelected;

    ImageCanvas(EditorSession session, Runnable onCropSelected) {
        this.session = session;
        this.onCropSelected = onCropSelected;
        setOpaque(true);
        setFocusable(true);
        MouseHandler handler = new MouseHandler();
        addMouseListener(handler);
        addMouseMotionListener(handler);
        addMouseWheelListener(handler);
    }

    @Override
    protected void paintComponent(Graphics graphics) {
        Graphics2D g = (Graphics2D) graphics.create();
        try {
            g.setColor(BACKGROUND);
            g.fillRect(0, 0, getWidth(), getHeight());
            session.document().ifPresent(document -> paintDocument(g, document));
            paintSelection(g);
            if (session.working()) {
                g.setColor(Color.LIGHT_GRAY);
                g.drawString("Working…", 10, getHeight() - 10);
            }
        } finally {
            g.dispose();
        }
    }

    private void paintDocument(Graphics2D g, ImageDocument document) {
        BufferedImage image = document.currentFrame().image();
        double scale = document.scale();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION,
            scale < 1.0 ? RenderingHints.VALUE_INTERPOLATION_BILINEAR
                        : RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
        AffineTransform transform = new AffineTransform();
        transform.translate(document.positionX(), document.positionY());
        transform.scale(scale, scale);
        transform.quadrantRotate(document.rotation());
        transform.translate(-image.getWidth() / 2.0, -image.getHeight() / 2.0);
        g.drawImage(image, transform, null);
    }

    private void paintSelection(Graphics2D g) {
        session.crop().selection().ifPresent(rect -> {
            int x = (int) Math.round(rect[0]);
            int y = (int) Math.round(rect[1]);
            int w = (int) Math.round(rect[2]);
            int h = (int) Math.round(rect[3]);
            g.setColor(SELECTION_FILL);
            g.fillRect(x, y, w, h);
            g.setColor(Color.WHITE);
            g.setStroke(new BasicStroke(1f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10f,
                new float[]{4f, 4f}, 0f));
            g.drawRect(x, y, w, h);
        });
    }

    private final class MouseHandler extends MouseAdapter {
        private Point last;

        @Override
        public void mousePressed(MouseEvent e) {
            requestFocusInWindow();
            last = e.getPoint();
        }

        @Override
        public void mouseDragged(MouseEvent e) {
            if (last == null || !session.viewAvailable()) {
                return;
            }
            double dx = e.getX() - last.getX();
            double dy = e.getY() - last.getY();
            last = e.getPoint();
            CropGesture crop = session.crop();
            if (crop.isCropping()) {
                crop.drag(e.getX(), e.getY(), dx, dy);
            } else {
                session.document().ifPresent(document -> document.pan(dx, dy));
            }
            repaint();
        }

        @Override
        public void mouseReleased(MouseEvent e) {
            last = null;
            if (session.crop().isDragging()) {
                onCropSelected.run();
            }
        }

        @Override
        public void mouseWheelMoved(MouseWheelEvent e) {
            if (!session.viewAvailable()) {
                return;
            }
            session.document().ifPresent(document ->
                document.zoom(-e.getPreciseWheelRotation(), e.getX(), e.getY()));
            repaint();
        }
    }
}
