package com.craftcatalogue.ui;

import com.craftcatalogue.dto.request.ComponentRequest;
import com.craftcatalogue.dto.response.ComponentDto;
import com.craftcatalogue.model.component.CatalogueComponent;

import javax.swing.*;
import javax.swing.border.TitledBorder;
import java.awt.*;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Entry form for a single component.
 * In {@link FormMode#IDLE} the form creates components, in
 * {@link FormMode#EDITING} it overwrites the loaded one.
 */
public class ComponentFormPanel extends JPanel {

    static final String NAME_REQUIRED = "Component name is required!";

    private static final double MAX_COST = new BigDecimal(CatalogueComponent.MAX_COST).doubleValue();

    /**
     * Receives the form's submit actions.
     */
    public interface Listener {
        void addRequested(ComponentRequest request);

        void updateRequested(Long id, ComponentRequest request);
    }

    private final String defaultUnit;

    private final JTextField nameField = new JTextField(20);
    private final JComboBox<String> categoryCombo = new JComboBox<>();
    private final JTextArea descriptionArea = new JTextArea(3, 20);
    private final JSpinner quantitySpinner = new JSpinner(new SpinnerNumberModel(0, 0, Integer.MAX_VALUE, 1));
    private final JTextField unitField = new JTextField(20);
    private final JSpinner costSpinner = new JSpinner(new SpinnerNumberModel(0.0, 0.0, MAX_COST, 0.01));
    private final JTextField supplierField = new JTextField(20);
    private final JTextField locationField = new JTextField(20);
    private final JTextArea notesArea = new JTextArea(3, 20);
    private final JLabel validationLabel = new JLabel(" ");

    private final JButton addButton = new JButton("Add Component");
    private final JButton updateButton = new JButton("Update Component");
    private final JButton clearButton = new JButton("Clear Form");

    private FormMode mode = FormMode.IDLE;
    private Long editingId;

    public ComponentFormPanel(String defaultUnit, Listener listener) {
        super(new BorderLayout(0, 8));
        this.defaultUnit = defaultUnit;

        categoryCombo.setEditable(true);
        descriptionArea.setLineWrap(true);
        descriptionArea.setWrapStyleWord(true);
        notesArea.setLineWrap(true);
        notesArea.setWrapStyleWord(true);
        costSpinner.setEditor(new JSpinner.NumberEditor(costSpinner, "0.00"));
        unitField.setText(defaultUnit);
        validationLabel.setForeground(new Color(180, 30, 30));

        JPanel fields = new JPanel(new GridBagLayout());
        fields.setBorder(new TitledBorder("Component Details"));
        int row = 0;
        addRow(fields, row++, "Name*:", nameField);
        addRow(fields, row++, "Category:", categoryCombo);
        addRow(fields, row++, "Description:", new JScrollPane(descriptionArea));
        addRow(fields, row++, "Quantity:", quantitySpinner);
        addRow(fields, row++, "Unit:", unitField);
        addRow(fields, row++, "Cost per Unit:", costSpinner);
        addRow(fields, row++, "Supplier:", supplierField);
        addRow(fields, row++, "Location:", locationField);
        addRow(fields, row++, "Notes:", new JScrollPane(notesArea));

        GridBagConstraints message = new GridBagConstraints();
        message.gridx = 0;
        message.gridy = row;
        message.gridwidth = 2;
        message.anchor = GridBagConstraints.WEST;
        message.insets = new Insets(4, 4, 4, 4);
        fields.add(validationLabel, message);

        addButton.addActionListener(e -> readForm().ifPresent(listener::addRequested));
        updateButton.addActionListener(e -> {
            if (mode == FormMode.EDITING) {
                readForm().ifPresent(request -> listener.updateRequested(editingId, request));
            }
        });
        clearButton.addActionListener(e -> clear());

        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.LEFT));
        buttons.add(addButton);
        buttons.add(updateButton);
        buttons.add(clearButton);

        add(fields, BorderLayout.NORTH);
        add(buttons, BorderLayout.CENTER);

        applyMode();
    }

    // ========================================================================
    // Form State
    // ========================================================================

    public FormMode getMode() {
        return mode;
    }

    public Long getEditingId() {
        return editingId;
    }

    /**
     * Load an existing component for editing.
     */
    public void populate(ComponentDto component) {
        nameField.setText(component.name());
        categoryCombo.setSelectedItem(component.category());
        descriptionArea.setText(component.description());
        quantitySpinner.setValue(component.quantity());
        unitField.setText(component.unit() == null || component.unit().isBlank() ? defaultUnit : component.unit());
        costSpinner.setValue(component.costPerUnit().doubleValue());
        supplierField.setText(component.supplier());
        locationField.setText(component.location());
        notesArea.setText(component.notes());

        editingId = component.id();
        mode = FormMode.EDITING;
        clearValidationError();
        applyMode();
    }

    /**
     * Reset every field and return to idle.
     */
    public void clear() {
        nameField.setText("");
        categoryCombo.setSelectedItem("");
        descriptionArea.setText("");
        quantitySpinner.setValue(0);
        unitField.setText(defaultUnit);
        costSpinner.setValue(0.0);
        supplierField.setText("");
        locationField.setText("");
        notesArea.setText("");

        editingId = null;
        mode = FormMode.IDLE;
        clearValidationError();
        applyMode();
    }

    /**
     * Replace the category suggestions, keeping whatever is typed.
     */
    public void setCategories(List<String> categories) {
        Object current = categoryCombo.getEditor().getItem();
        DefaultComboBoxModel<String> model = new DefaultComboBoxModel<>();
        categories.forEach(model::addElement);
        categoryCombo.setModel(model);
        categoryCombo.setSelectedItem(current == null ? "" : current.toString());
    }

    public void showValidationError(String message) {
        validationLabel.setText(message);
    }

    public void clearValidationError() {
        validationLabel.setText(" ");
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    /**
     * Current field values, or empty (with an inline message) if the name is blank.
     */
    Optional<ComponentRequest> readForm() {
        String name = nameField.getText().trim();
        if (name.isEmpty()) {
            showValidationError(NAME_REQUIRED);
            nameField.requestFocusInWindow();
            return Optional.empty();
        }
        clearValidationError();

        Object category = categoryCombo.getEditor().getItem();
        BigDecimal cost = BigDecimal.valueOf(((Number) costSpinner.getValue()).doubleValue())
            .setScale(2, RoundingMode.HALF_UP);

        return Optional.of(new ComponentRequest(
            name,
            category == null ? "" : category.toString().trim(),
            descriptionArea.getText().trim(),
            ((Number) quantitySpinner.getValue()).intValue(),
            unitField.getText().trim(),
            cost,
            supplierField.getText().trim(),
            locationField.getText().trim(),
            notesArea.getText().trim()
        ));
    }

    private void applyMode() {
        addButton.setEnabled(mode == FormMode.IDLE);
        updateButton.setEnabled(mode == FormMode.EDITING);
    }

    private static void addRow(JPanel panel, int row, String label, JComponent field) {
        GridBagConstraints labelConstraints = new GridBagConstraints();
        labelConstraints.gridx = 0;
        labelConstraints.gridy = row;
        labelConstraints.anchor = GridBagConstraints.NORTHEAST;
        labelConstraints.insets = new Insets(4, 4, 4, 4);
        panel.add(new JLabel(label), labelConstraints);

        GridBagConstraints fieldConstraints = new GridBagConstraints();
        fieldConstraints.gridx = 1;
        fieldConstraints.gridy = row;
        fieldConstraints.weightx = 1.0;
        fieldConstraints.fill = GridBagConstraints.HORIZONTAL;
        fieldConstraints.insets = new Insets(4, 4, 4, 4);
        panel.add(field, fieldConstraints);
    }
}
