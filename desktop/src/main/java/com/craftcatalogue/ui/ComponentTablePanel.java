package com.craftcatalogue.ui;

import com.craftcatalogue.dto.response.ComponentDto;
import com.craftcatalogue.model.enums.ReportLayout;

import javax.swing.*;
import javax.swing.event.DocumentEvent;
import javax.swing.event.DocumentListener;
import java.awt.*;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.util.List;
import java.util.Optional;

/**
 * Searchable, filterable table of components with the table-level actions.
 */
public class ComponentTablePanel extends JPanel {

    /**
     * Receives the panel's user actions.
     */
    public interface Listener {
        void filterChanged();

        void editSelected();

        void deleteSelected();

        void importRequested();

        void exportRequested();

        void printRequested(ReportLayout layout);
    }

    private final ComponentTableModel model = new ComponentTableModel();
    private final JTable table = new JTable(model);
    private final JTextField searchField = new JTextField(24);
    private final JComboBox<String> categoryFilter = new JComboBox<>();
    private final JButton editButton = new JButton("Edit Selected");
    private final JButton deleteButton = new JButton("Delete Selected");

    /** Set while the category list is rebuilt, so the rebuild does not count as a filter change. */
    private boolean updatingCategories;

    public ComponentTablePanel(Listener listener) {
        super(new BorderLayout(0, 8));

        searchField.setToolTipText("Search by name, category, or description...");
        searchField.getDocument().addDocumentListener(new DocumentListener() {
            @Override
            public void insertUpdate(DocumentEvent e) {
                listener.filterChanged();
            }

            @Override
            public void removeUpdate(DocumentEvent e) {
                listener.filterChanged();
            }

            @Override
            public void changedUpdate(DocumentEvent e) {
                listener.filterChanged();
            }
        });

        categoryFilter.addItem(ComponentFilter.ALL_CATEGORIES);
        categoryFilter.addActionListener(e -> {
            if (!updatingCategories) {
                listener.filterChanged();
            }
        });

        JPanel controls = new JPanel(new FlowLayout(FlowLayout.LEFT));
        controls.add(new JLabel("Search:"));
        controls.add(searchField);
        controls.add(new JLabel("Filter by Category:"));
        controls.add(categoryFilter);

        table.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
        table.setAutoCreateRowSorter(true);
        table.removeColumn(table.getColumnModel().getColumn(ComponentTableModel.ID_COLUMN));
        table.getSelectionModel().addListSelectionListener(e -> updateSelectionButtons());
        table.addMouseListener(new MouseAdapter() {
            @Override
            public void mouseClicked(MouseEvent e) {
                if (e.getClickCount() == 2 && table.getSelectedRow() >= 0) {
                    listener.editSelected();
                }
            }
        });

        editButton.addActionListener(e -> listener.editSelected());
        deleteButton.addActionListener(e -> listener.deleteSelected());
        JButton importButton = new JButton("Import from Excel");
        importButton.addActionListener(e -> listener.importRequested());
        JButton exportButton = new JButton("Export to Excel");
        exportButton.addActionListener(e -> listener.exportRequested());
        JButton printButton = new JButton("Print Catalogue");
        printButton.addActionListener(e -> listener.printRequested(ReportLayout.CATALOGUE));

        JPanel actions = new JPanel(new BorderLayout());
        JPanel rowActions = new JPanel(new FlowLayout(FlowLayout.LEFT));
        rowActions.add(editButton);
        rowActions.add(deleteButton);
        JPanel fileActions = new JPanel(new FlowLayout(FlowLayout.RIGHT));
        fileActions.add(importButton);
        fileActions.add(exportButton);
        fileActions.add(printButton);
        actions.add(rowActions, BorderLayout.WEST);
        actions.add(fileActions, BorderLayout.EAST);

        add(controls, BorderLayout.NORTH);
        add(new JScrollPane(table), BorderLayout.CENTER);
        add(actions, BorderLayout.SOUTH);

        updateSelectionButtons();
    }

    public String getSearchText() {
        return searchField.getText();
    }

    public String getSelectedCategory() {
        Object selected = categoryFilter.getSelectedItem();
        return selected == null ? ComponentFilter.ALL_CATEGORIES : selected.toString();
    }

    /**
     * Rebuild the category dropdown, keeping the current choice if it still exists.
     */
    public void setCategories(List<String> categories) {
        String current = getSelectedCategory();
        updatingCategories = true;
        try {
            categoryFilter.removeAllItems();
            categoryFilter.addItem(ComponentFilter.ALL_CATEGORIES);
            categories.forEach(categoryFilter::addItem);
            categoryFilter.setSelectedItem(categories.contains(current) ? current : ComponentFilter.ALL_CATEGORIES);
        } finally {
            updatingCategories = false;
        }
    }

    public void showComponents(List<ComponentDto> components) {
        model.setComponents(components);
        updateSelectionButtons();
    }

    /**
     * Components currently shown, in model order.
     */
    public List<ComponentDto> getVisibleComponents() {
        return model.getComponents();
    }

    public Optional<ComponentDto> getSelectedComponent() {
        int viewRow = table.getSelectedRow();
        if (viewRow < 0) {
            return Optional.empty();
        }
        return Optional.of(model.getComponentAt(table.convertRowIndexToModel(viewRow)));
    }

    private void updateSelectionButtons() {
        boolean selected = table.getSelectedRow() >= 0;
        editButton.setEnabled(selected);
        deleteButton.setEnabled(selected);
    }
}
