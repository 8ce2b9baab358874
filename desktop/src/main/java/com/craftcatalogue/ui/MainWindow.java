package com.craftcatalogue.ui;

import com.craftcatalogue.CraftCatalogueApplication;
import com.craftcatalogue.controller.CatalogueController;
import com.craftcatalogue.dto.request.ComponentRequest;
import com.craftcatalogue.dto.response.ActionResult;
import com.craftcatalogue.dto.response.ComponentDto;
import com.craftcatalogue.dto.response.ComponentStatsDto;
import com.craftcatalogue.model.enums.ReportLayout;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.*;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Main application window: entry form on the left, component table on the right.
 * Holds the last fetched components and filters them locally; every mutation
 * re-fetches from the store.
 */
public class MainWindow extends JFrame implements ComponentFormPanel.Listener, ComponentTablePanel.Listener {

    private final CatalogueController controller;
    private final ComponentFormPanel formPanel;
    private final ComponentTablePanel tablePanel;
    private final JLabel statusLabel = new JLabel(" ");

    private List<ComponentDto> lastFetched = new ArrayList<>();

    public MainWindow(CatalogueController controller, Runnable onClose) {
        super(CraftCatalogueApplication.APPLICATION_NAME);
        this.controller = controller;
        this.formPanel = new ComponentFormPanel(controller.getSettings().defaultUnit(), this);
        this.tablePanel = new ComponentTablePanel(this);

        setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosed(WindowEvent e) {
                onClose.run();
            }
        });
        setSize(1200, 800);
        setLocationRelativeTo(null);

        JSplitPane split = new JSplitPane(JSplitPane.HORIZONTAL_SPLIT,
            new JScrollPane(formPanel), tablePanel);
        split.setDividerLocation(400);

        statusLabel.setBorder(new EmptyBorder(4, 8, 4, 8));

        JPanel root = new JPanel(new BorderLayout());
        root.setBorder(new EmptyBorder(8, 8, 0, 8));
        root.add(split, BorderLayout.CENTER);
        root.add(statusLabel, BorderLayout.SOUTH);
        setContentPane(root);
        setJMenuBar(createMenuBar());

        refresh();
    }

    // ========================================================================
    // Data Refresh
    // ========================================================================

    /**
     * Re-fetch components and categories, then re-apply the current filter.
     */
    void refresh() {
        ActionResult<List<ComponentDto>> components = controller.loadComponents();
        if (!components.success()) {
            report(components);
            return;
        }
        lastFetched = components.value();

        ActionResult<List<String>> categories = controller.loadCategories();
        if (categories.success()) {
            tablePanel.setCategories(categories.value());
            formPanel.setCategories(categories.value());
        } else {
            report(categories);
        }
        filterChanged();
    }

    @Override
    public void filterChanged() {
        List<ComponentDto> visible = ComponentFilter.apply(
            lastFetched, tablePanel.getSearchText(), tablePanel.getSelectedCategory());
        tablePanel.showComponents(visible);

        ComponentStatsDto stats = ComponentStatsDto.of(visible);
        statusLabel.setText(String.format(Locale.ROOT,
            "Showing %d of %d components | Total items: %d | Total value: $%s",
            visible.size(), lastFetched.size(), stats.totalQuantity(), stats.totalValue().toPlainString()));
    }

    // ========================================================================
    // Form Actions
    // ========================================================================

    @Override
    public void addRequested(ComponentRequest request) {
        ActionResult<ComponentDto> result = controller.addComponent(request);
        if (result.success()) {
            refresh();
            formPanel.clear();
        } else if (result.kind() == ActionResult.Kind.VALIDATION) {
            formPanel.showValidationError(result.message());
        }
        report(result);
    }

    @Override
    public void updateRequested(Long id, ComponentRequest request) {
        ActionResult<ComponentDto> result = controller.updateComponent(id, request);
        if (result.success()) {
            refresh();
            formPanel.clear();
        } else if (result.kind() == ActionResult.Kind.VALIDATION) {
            formPanel.showValidationError(result.message());
        }
        report(result);
    }

    // ========================================================================
    // Table Actions
    // ========================================================================

    @Override
    public void editSelected() {
        tablePanel.getSelectedComponent().ifPresent(selected -> {
            ActionResult<ComponentDto> result = controller.findComponent(selected.id());
            if (result.success()) {
                formPanel.populate(result.value());
            } else {
                report(result);
                refresh();
            }
        });
    }

    @Override
    public void deleteSelected() {
        Optional<ComponentDto> selected = tablePanel.getSelectedComponent();
        if (selected.isEmpty()) {
            return;
        }
        ComponentDto component = selected.get();

        int reply = JOptionPane.showConfirmDialog(this,
            "Are you sure you want to delete '" + component.name() + "'?",
            "Confirm Delete", JOptionPane.YES_NO_OPTION);
        if (reply != JOptionPane.YES_OPTION) {
            return;
        }

        ActionResult<Void> result = controller.deleteComponent(component.id());
        if (result.success() && component.id().equals(formPanel.getEditingId())) {
            formPanel.clear();
        }
        refresh();
        report(result);
    }

    @Override
    public void importRequested() {
        JFileChooser chooser = new JFileChooser();
        chooser.setDialogTitle("Import Excel File");
        chooser.setFileFilter(new FileNameExtensionFilter("Excel files (*.xlsx, *.xls)", "xlsx", "xls"));
        if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }

        report(controller.importSpreadsheet(chooser.getSelectedFile().toPath()));
        refresh();
    }

    @Override
    public void exportRequested() {
        chooseSaveFile("Export to Excel", controller.getSettings().exportFileName(), "Excel files (*.xlsx)", "xlsx")
            .ifPresent(file -> report(controller.exportSpreadsheet(tablePanel.getVisibleComponents(), file)));
    }

    @Override
    public void printRequested(ReportLayout layout) {
        chooseSaveFile("Save PDF", controller.getSettings().reportFileName(), "PDF files (*.pdf)", "pdf")
            .ifPresent(file -> report(controller.printReport(layout, tablePanel.getVisibleComponents(), file)));
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private JMenuBar createMenuBar() {
        JMenuBar menuBar = new JMenuBar();

        JMenu fileMenu = new JMenu("File");
        fileMenu.add(menuItem("Import from Excel", this::importRequested));
        fileMenu.add(menuItem("Export to Excel", this::exportRequested));
        fileMenu.addSeparator();
        fileMenu.add(menuItem("Print Catalogue", () -> printRequested(ReportLayout.CATALOGUE)));
        fileMenu.add(menuItem("Print Details", () -> printRequested(ReportLayout.DETAILS)));
        fileMenu.add(menuItem("Print Category Summary", () -> printRequested(ReportLayout.CATEGORY_SUMMARY)));
        fileMenu.addSeparator();
        fileMenu.add(menuItem("Exit", this::dispose));

        JMenu helpMenu = new JMenu("Help");
        helpMenu.add(menuItem("About", this::showAbout));

        menuBar.add(fileMenu);
        menuBar.add(helpMenu);
        return menuBar;
    }

    private static JMenuItem menuItem(String text, Runnable action) {
        JMenuItem item = new JMenuItem(text);
        item.addActionListener(e -> action.run());
        return item;
    }

    /**
     * Ask for a destination file, adding the extension if missing and confirming overwrites.
     */
    private Optional<Path> chooseSaveFile(String title, String suggestedName, String description, String extension) {
        JFileChooser chooser = new JFileChooser();
        chooser.setDialogTitle(title);
        chooser.setSelectedFile(new File(suggestedName));
        chooser.setFileFilter(new FileNameExtensionFilter(description, extension));
        if (chooser.showSaveDialog(this) != JFileChooser.APPROVE_OPTION) {
            return Optional.empty();
        }

        Path file = chooser.getSelectedFile().toPath();
        if (!file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith("." + extension)) {
            file = file.resolveSibling(file.getFileName() + "." + extension);
        }
        if (Files.exists(file)) {
            int reply = JOptionPane.showConfirmDialog(this,
                file.getFileName() + " already exists. Replace it?", title, JOptionPane.YES_NO_OPTION);
            if (reply != JOptionPane.YES_OPTION) {
                return Optional.empty();
            }
        }
        return Optional.of(file);
    }

    /**
     * Show the outcome of an action: information on success, warning for
     * rejected input, error for storage and file failures.
     */
    private void report(ActionResult<?> result) {
        if (result.success()) {
            if (result.message() != null) {
                JOptionPane.showMessageDialog(this, result.message(), "Success", JOptionPane.INFORMATION_MESSAGE);
            }
            return;
        }
        switch (result.kind()) {
            case VALIDATION, NOT_FOUND -> JOptionPane.showMessageDialog(
                this, result.message(), "Warning", JOptionPane.WARNING_MESSAGE);
            default -> JOptionPane.showMessageDialog(
                this, result.message(), "Error", JOptionPane.ERROR_MESSAGE);
        }
    }

    private void showAbout() {
        JOptionPane.showMessageDialog(this,
            CraftCatalogueApplication.APPLICATION_NAME + " v" + CraftCatalogueApplication.APPLICATION_VERSION + "\n\n"
                + "A desktop application for managing crafting components inventory.\n\n"
                + "Features:\n"
                + "- Add, edit, and delete components\n"
                + "- Import from Excel files\n"
                + "- Export to Excel and PDF\n"
                + "- Search and filter components\n"
                + "- Print catalogue, details and category summary",
            "About " + CraftCatalogueApplication.APPLICATION_NAME, JOptionPane.INFORMATION_MESSAGE);
    }
}
