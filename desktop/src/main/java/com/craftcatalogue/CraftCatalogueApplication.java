package com.craftcatalogue;

import com.craftcatalogue.controller.CatalogueController;
import com.craftcatalogue.ui.MainWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.NestedExceptionUtils;

import javax.swing.JOptionPane;
import javax.swing.SwingUtilities;
import javax.swing.UIManager;
import javax.swing.UnsupportedLookAndFeelException;
import java.awt.GraphicsEnvironment;

/**
 * Crafting Components Catalogue.
 * Starts the Spring context (database, services) and then opens the main window.
 */
@SpringBootApplication
@Slf4j
public class CraftCatalogueApplication {

    public static final String APPLICATION_NAME = "Crafting Components Catalogue";
    public static final String APPLICATION_VERSION = "2.0.0";

    public static void main(String[] args) {
        ConfigurableApplicationContext context;
        try {
            context = new SpringApplicationBuilder(CraftCatalogueApplication.class)
                .headless(false)
                .run(args);
        } catch (RuntimeException e) {
            log.error("Failed to start {}", APPLICATION_NAME, e);
            showStartupFailure(e);
            System.exit(1);
            return;
        }

        CatalogueController controller = context.getBean(CatalogueController.class);
        SwingUtilities.invokeLater(() -> {
            useSystemLookAndFeel();
            MainWindow window = new MainWindow(controller, context::close);
            window.setVisible(true);
        });
    }

    /**
     * Blocking error dialog for failures before the main window exists, e.g. a database locked by another instance.
     */
    private static void showStartupFailure(RuntimeException e) {
        if (GraphicsEnvironment.isHeadless()) {
            return;
        }
        JOptionPane.showMessageDialog(null, startupFailureMessage(e), "Startup Error", JOptionPane.ERROR_MESSAGE);
    }

    /**
     * Message naming the innermost cause, which for a locked database is the H2 error rather than the bean failure.
     */
    static String startupFailureMessage(Throwable e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        return "Could not start " + APPLICATION_NAME + ":\n" + cause.getMessage();
    }

    private static void useSystemLookAndFeel() {
        try {
            UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
        } catch (ClassNotFoundException | InstantiationException | IllegalAccessException
                 | UnsupportedLookAndFeelException e) {
            log.warn("System look and feel unavailable, using default: {}", e.getMessage());
        }
    }
}
