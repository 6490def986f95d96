package com.glimpse.ui;

import com.glimpse.config.ConfigService;
import com.glimpse.core.io.StandardImageCodec;
import com.glimpse.logging.AppLogger;

import javax.swing.*;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Desktop entry point. An optional first argument names an image to open at startup.
 */
public final class ViewerApp {

    private static final Logger LOGGER = AppLogger.get();

    private ViewerApp() {
    }

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((thread, ex) ->
            LOGGER.log(Level.SEVERE, "Uncaught exception on " + thread.getName(), ex));
        SwingUtilities.invokeLater(() -> {
            try {
                UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
            } catch (ReflectiveOperationException | UnsupportedLookAndFeelException ex) {
                LOGGER.log(Level.FINE, "System look and feel unavailable", ex);
            }
            ViewerFrame viewer = new ViewerFrame(ConfigService.standard(), new StandardImageCodec(), new AwtClipboard());
            viewer.show();
            if (args.length > 0) {
                viewer.open(Path.of(args[0]));
            }
            LOGGER.info("Viewer started");
        });
    }
}
