package com.glimpse.ui;

import com.glimpse.config.ConfigService;
import com.glimpse.core.cache.FrameCache;
import com.glimpse.core.document.ImageDocument;
import com.glimpse.core.fs.ImageList;
import com.glimpse.core.history.UndoStack;
import com.glimpse.core.io.ImageCodec;
import com.glimpse.core.io.ImageFormat;
import com.glimpse.core.ops.ClipboardAccess;
import com.glimpse.core.ops.Op;
import com.glimpse.core.ops.OpQueue;
import com.glimpse.core.session.EditorSession;
import com.glimpse.logging.AppLogger;

import javax.swing.*;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.*;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.awt.event.ActionEvent;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main viewer window. A 16 ms Swing timer drives {@link EditorSession#poll()} and GIF playback;
 * every menu item and shortcut turns into an {@link Op} on the session.
 */
public class ViewerFrame {

    private static final Logger LOGGER = AppLogger.get();
    private static final String APP_NAME = "Glimpse";
    private static final int TICK_MILLIS = 16;

    private final ConfigService config;
    private final EditorSession session;
    private final JFrame frame;
    private final ImageCanvas canvas;
    private final Timer ticker;

    private long lastTickNanos = System.nanoTime();
    private Rectangle windowedBounds;

    public ViewerFrame(ConfigService config, ImageCodec codec, ClipboardAccess clipboard) {
        this.config = config;
        OpQueue opQueue = new OpQueue(codec, clipboard, this::reportError,
            new FrameCache(config.cacheMaxEntries(), config.cacheMaxBytes()),
            new UndoStack(config.undoLimit()));
        this.session = new EditorSession(opQueue);

        frame = new JFrame(APP_NAME);
        frame.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        frame.setSize(config.windowSize());
        frame.setLocationByPlatform(true);

        canvas = new ImageCanvas(session, this::finishCrop);
        canvas.setTransferHandler(new FileDropHandler());
        canvas.addComponentListener(new ComponentAdapter() {
            @Override
            public void componentResized(ComponentEvent e) {
                session.setViewport(canvas.getWidth(), canvas.getHeight());
            }
        });
        frame.add(canvas, BorderLayout.CENTER);
        frame.setJMenuBar(buildMenuBar());
        bindKeys(frame.getRootPane());

        session.addListener(document -> updateTitle());
        frame.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosed(WindowEvent e) {
                shutdown();
            }
        });

        ticker = new Timer(TICK_MILLIS, e -> tick());
        ticker.start();
    }

    public void show() {
        frame.setVisible(true);
        session.setViewport(canvas.getWidth(), canvas.getHeight());
    }

    /** Queues a file to open, as if it had been picked in the open dialog. */
    public void open(Path path) {
        submit(new Op.LoadPath(path, false));
    }

    private void tick() {
        long now = System.nanoTime();
        long elapsedMillis = (now - lastTickNanos) / 1_000_000L;
        lastTickNanos = now;
        boolean changed = session.poll() > 0;
        Optional<ImageDocument> document = session.document();
        if (document.isPresent() && document.get().isAnimated()) {
            document.get().advanceAnimation(elapsedMillis);
            changed = true;
        }
        if (changed || session.working()) {
            canvas.repaint();
        }
    }

    private boolean submit(Op op) {
        boolean accepted = session.queue(op);
        if (!accepted) {
            LOGGER.fine(() -> "Ignored " + op.getClass().getSimpleName() + " while busy or without an image");
        }
        canvas.repaint();
        return accepted;
    }

    private void reportError(String message) {
        SwingUtilities.invokeLater(() ->
            JOptionPane.showMessageDialog(frame, message, APP_NAME, JOptionPane.ERROR_MESSAGE));
    }

    private JMenuBar buildMenuBar() {
        JMenuBar bar = new JMenuBar();

        JMenu file = new JMenu("File");
        file.add(item("Open…", KeyEvent.VK_O, InputEvent.CTRL_DOWN_MASK, this::chooseAndOpen));
        file.add(item("Save As…", KeyEvent.VK_S, InputEvent.CTRL_DOWN_MASK, this::chooseAndSave));
        file.add(item("Reload", KeyEvent.VK_F5, 0, this::reload));
        file.add(item("Move to Trash", KeyEvent.VK_DELETE, 0, this::moveToTrash));
        file.add(item("Close", KeyEvent.VK_F4, InputEvent.CTRL_DOWN_MASK, () -> submit(new Op.Close())));
        file.addSeparator();
        file.add(item("Exit", 0, 0, frame::dispose));
        bar.add(file);

        JMenu edit = new JMenu("Edit");
        edit.add(item("Undo", KeyEvent.VK_Z, InputEvent.CTRL_DOWN_MASK, () -> submit(new Op.Undo())));
        edit.add(item("Redo", KeyEvent.VK_Y, InputEvent.CTRL_DOWN_MASK, () -> submit(new Op.Redo())));
        edit.addSeparator();
        edit.add(item("Copy", KeyEvent.VK_C, InputEvent.CTRL_DOWN_MASK, () -> submit(new Op.Copy())));
        edit.add(item("Paste", KeyEvent.VK_V, InputEvent.CTRL_DOWN_MASK, () -> submit(new Op.Paste())));
        edit.addSeparator();
        edit.add(item("Crop", KeyEvent.VK_X, InputEvent.CTRL_DOWN_MASK, this::beginCrop));
        edit.add(item("Resize…", KeyEvent.VK_R, InputEvent.CTRL_DOWN_MASK, this::resize));
        edit.add(item("Adjust Colors…", KeyEvent.VK_H, InputEvent.CTRL_DOWN_MASK, this::adjustColors));
        edit.addSeparator();
        edit.add(item("Rotate Left", KeyEvent.VK_Q, 0, () -> submit(new Op.Rotate(-1))));
        edit.add(item("Rotate Right", KeyEvent.VK_E, 0, () -> submit(new Op.Rotate(1))));
        edit.add(item("Flip Horizontal", KeyEvent.VK_H, 0, () -> submit(new Op.FlipHorizontal())));
        edit.add(item("Flip Vertical", KeyEvent.VK_V, 0, () -> submit(new Op.FlipVertical())));
        bar.add(edit);

        JMenu view = new JMenu("View");
        view.add(item("Previous Image", KeyEvent.VK_LEFT, 0, () -> submit(new Op.Prev())));
        view.add(item("Next Image", KeyEvent.VK_RIGHT, 0, () -> submit(new Op.Next())));
        view.addSeparator();
        view.add(item("Best Fit", KeyEvent.VK_B, 0, this::bestFit));
        view.add(item("Largest Fit", KeyEvent.VK_F, 0, this::largestFit));
        view.add(item("Full Screen", KeyEvent.VK_F11, 0, this::toggleFullScreen));
        bar.add(view);
        return bar;
    }

    private static JMenuItem item(String label, int key, int modifiers, Runnable action) {
        JMenuItem item = new JMenuItem(label);
        if (key != 0) {
            item.setAccelerator(KeyStroke.getKeyStroke(key, modifiers));
        }
        item.addActionListener(e -> action.run());
        return item;
    }

    /** Shortcuts without a menu entry. */
    private void bindKeys(JRootPane root) {
        InputMap input = root.getInputMap(JComponent.WHEN_IN_FOCUSED_WINDOW);
        ActionMap actions = root.getActionMap();
        bind(input, actions, KeyStroke.getKeyStroke(KeyEvent.VK_A, 0), "prev", () -> submit(new Op.Prev()));
        bind(input, actions, KeyStroke.getKeyStroke(KeyEvent.VK_D, 0), "next", () -> submit(new Op.Next()));
        bind(input, actions, KeyStroke.getKeyStroke(KeyEvent.VK_ESCAPE, 0), "cancelCrop", this::cancelCrop);
        bind(input, actions, KeyStroke.getKeyStroke(KeyEvent.VK_EQUALS, 0), "zoomIn", () -> zoomStep(1));
        bind(input, actions, KeyStroke.getKeyStroke(KeyEvent.VK_ADD, 0), "zoomInPad", () -> zoomStep(1));
        bind(input, actions, KeyStroke.getKeyStroke(KeyEvent.VK_MINUS, 0), "zoomOut", () -> zoomStep(-1));
        bind(input, actions, KeyStroke.getKeyStroke(KeyEvent.VK_SUBTRACT, 0), "zoomOutPad", () -> zoomStep(-1));
        for (int digit = 1; digit <= 9; digit++) {
            int factor = digit;
            bind(input, actions, KeyStroke.getKeyStroke(KeyEvent.VK_0 + digit, 0), "zoom" + digit,
                () -> zoomTo(factor));
        }
    }

    private static void bind(InputMap input, ActionMap actions, KeyStroke stroke, String name, Runnable action) {
        input.put(stroke, name);
        actions.put(name, new AbstractAction() {
            @Override
            public void actionPerformed(ActionEvent e) {
                action.run();
            }
        });
    }

    private void chooseAndOpen() {
        JFileChooser chooser = new JFileChooser();
        config.lastOpenDirectory().ifPresent(dir -> chooser.setCurrentDirectory(dir.toFile()));
        chooser.setFileFilter(new FileNameExtensionFilter("Images", decodableExtensions()));
        if (chooser.showOpenDialog(frame) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        Path path = chooser.getSelectedFile().toPath();
        config.setLastOpenDirectory(path.getParent());
        submit(new Op.LoadPath(path, false));
    }

    private void chooseAndSave() {
        Optional<ImageDocument> document = session.document();
        if (document.isEmpty() || !session.viewAvailable()) {
            return;
        }
        JFileChooser chooser = new JFileChooser();
        Path start = config.lastSaveDirectory()
            .or(() -> Optional.ofNullable(document.get().path()).map(Path::getParent))
            .orElse(null);
        if (start != null) {
            chooser.setCurrentDirectory(start.toFile());
        }
        String title = document.get().title();
        chooser.setSelectedFile(new File(title.isEmpty() ? "untitled.png" : title));
        chooser.setFileFilter(new FileNameExtensionFilter("Writable images",
            ImageFormat.encodableExtensions().toArray(String[]::new)));
        if (chooser.showSaveDialog(frame) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        Path target = chooser.getSelectedFile().toPath();
        if (ImageFormat.fromPath(target).filter(ImageFormat::canEncode).isEmpty()) {
            reportError("Cannot save " + target.getFileName() + ": unknown or read-only image format");
            return;
        }
        config.setLastSaveDirectory(target.toAbsolutePath().getParent());
        submit(new Op.Save(target));
    }

    private void reload() {
        session.document().map(ImageDocument::path).ifPresent(path -> {
            if (!session.working()) {
                submit(new Op.LoadPath(path, true));
            }
        });
    }

    private void moveToTrash() {
        Optional<Path> current = session.document().map(ImageDocument::path);
        if (current.isEmpty() || session.working()) {
            return;
        }
        if (!Desktop.isDesktopSupported() || !Desktop.getDesktop().isSupported(Desktop.Action.MOVE_TO_TRASH)) {
            reportError("Moving files to the trash is not supported on this system");
            return;
        }
        Path doomed = current.get();
        int answer = JOptionPane.showConfirmDialog(frame, "Move " + doomed.getFileName() + " to the trash?",
            APP_NAME, JOptionPane.YES_NO_OPTION, JOptionPane.WARNING_MESSAGE);
        if (answer != JOptionPane.YES_OPTION) {
            return;
        }
        ImageList list = session.imageList();
        Optional<Path> following = list.peekNext().filter(next -> !next.equals(list.current().orElse(null)));
        if (!Desktop.getDesktop().moveToTrash(doomed.toFile())) {
            reportError("Could not move " + doomed.getFileName() + " to the trash");
            return;
        }
        LOGGER.info(() -> "Moved to trash: " + doomed);
        submit(following.<Op>map(next -> new Op.LoadPath(next, true)).orElseGet(Op.Close::new));
    }

    private void beginCrop() {
        if (session.viewAvailable()) {
            session.crop().begin();
            canvas.setCursor(Cursor.getPredefinedCursor(Cursor.CROSSHAIR_CURSOR));
        }
    }

    private void finishCrop() {
        canvas.setCursor(Cursor.getDefaultCursor());
        session.crop().release(session.document().orElse(null))
            .filter(rect -> !rect.isEmpty())
            .ifPresent(rect -> submit(new Op.Crop(rect)));
        canvas.repaint();
    }

    private void cancelCrop() {
        session.crop().cancel();
        canvas.setCursor(Cursor.getDefaultCursor());
        canvas.repaint();
    }

    private void resize() {
        if (!session.viewAvailable()) {
            return;
        }
        ImageDocument document = session.document().orElseThrow();
        new ResizeDialog(document.displayWidth(), document.displayHeight(), config.defaultResampleFilter())
            .prompt(frame)
            .ifPresent(op -> {
                config.setDefaultResampleFilter(op.filter());
                submit(op);
            });
    }

    private void adjustColors() {
        if (!session.viewAvailable()) {
            return;
        }
        ImageDocument document = session.document().orElseThrow();
        new ColorDialog().prompt(frame, document).ifPresent(adjustment -> submit(new Op.Color(adjustment)));
    }

    private void bestFit() {
        session.bestFit();
        canvas.repaint();
    }

    private void largestFit() {
        session.largestFit();
        canvas.repaint();
    }

    private void zoomTo(int factor) {
        session.document().ifPresent(document -> {
            document.setZoomFactor(factor);
            canvas.repaint();
        });
    }

    private void zoomStep(int steps) {
        if (!session.viewAvailable()) {
            return;
        }
        session.document().ifPresent(document -> {
            document.zoom(steps, canvas.getWidth() / 2.0, canvas.getHeight() / 2.0);
            canvas.repaint();
        });
    }

    private void toggleFullScreen() {
        GraphicsDevice device = frame.getGraphicsConfiguration().getDevice();
        if (!device.isFullScreenSupported()) {
            return;
        }
        if (device.getFullScreenWindow() == frame) {
            device.setFullScreenWindow(null);
            if (windowedBounds != null) {
                frame.setBounds(windowedBounds);
            }
        } else {
            windowedBounds = frame.getBounds();
            device.setFullScreenWindow(frame);
        }
    }

    private void updateTitle() {
        Optional<ImageDocument> document = session.document();
        if (document.isEmpty()) {
            frame.setTitle(APP_NAME);
            return;
        }
        StringBuilder title = new StringBuilder();
        String name = document.get().title();
        title.append(name.isEmpty() ? "Pasted image" : name);
        if (session.modified()) {
            title.append(" *");
        }
        ImageList list = session.imageList();
        if (!list.isEmpty()) {
            title.append(" (").append(list.index() + 1).append('/').append(list.size()).append(')');
        }
        title.append(" - ").append(APP_NAME);
        frame.setTitle(title.toString());
    }

    private void shutdown() {
        ticker.stop();
        if (frame.getExtendedState() == Frame.NORMAL) {
            config.setWindowSize(frame.getSize());
        }
        session.close();
        LOGGER.info("Viewer closed");
    }

    private static String[] decodableExtensions() {
        return Arrays.stream(ImageFormat.values())
            .flatMap(format -> format.extensions().stream())
            .toArray(String[]::new);
    }

    /** Opens the first dropped file and rebuilds the listing around it. */
    private final class FileDropHandler extends TransferHandler {

        @Override
        public boolean canImport(TransferSupport support) {
            return support.isDataFlavorSupported(DataFlavor.javaFileListFlavor);
        }

        @Override
        public boolean importData(TransferSupport support) {
            if (!canImport(support) || session.working()) {
                return false;
            }
            try {
                @SuppressWarnings("unchecked")
                List<File> files = (List<File>) support.getTransferable().getTransferData(DataFlavor.javaFileListFlavor);
                if (files.isEmpty()) {
                    return false;
                }
                return submit(new Op.LoadPath(files.get(0).toPath(), true));
            } catch (UnsupportedFlavorException | IOException ex) {
                LOGGER.log(Level.WARNING, "Drop could not be read", ex);
                return false;
            }
        }
    }
}
