package com.craftcatalogue.ui;

import com.craftcatalogue.dto.response.ComponentDto;

import javax.swing.table.AbstractTableModel;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Table model over a list of components. Column 0 holds the id and is hidden by the view.
 */
public class ComponentTableModel extends AbstractTableModel {

    static final int ID_COLUMN = 0;

    private static final String[] COLUMNS = {
        "ID", "Name", "Category", "Description", "Quantity",
        "Unit", "Cost/Unit", "Supplier", "Location", "Notes"
    };

    private List<ComponentDto> components = new ArrayList<>();

    public void setComponents(List<ComponentDto> components) {
        this.components = new ArrayList<>(components);
        fireTableDataChanged();
    }

    public List<ComponentDto> getComponents() {
        return List.copyOf(components);
    }

    public ComponentDto getComponentAt(int row) {
        return components.get(row);
    }

    @Override
    public int getRowCount() {
        return components.size();
    }

    @Override
    public int getColumnCount() {
        return COLUMNS.length;
    }

    @Override
    public String getColumnName(int column) {
        return COLUMNS[column];
    }

    @Override
    public Class<?> getColumnClass(int column) {
        return switch (column) {
            case 0 -> Long.class;
            case 4 -> Integer.class;
            case 6 -> BigDecimal.class;
            default -> String.class;
        };
    }

    @Override
    public Object getValueAt(int row, int column) {
        ComponentDto c = components.get(row);
        return switch (column) {
            case 0 -> c.id();
            case 1 -> c.name();
            case 2 -> c.category();
            case 3 -> c.description();
            case 4 -> c.quantity();
            case 5 -> c.unit();
            case 6 -> c.costPerUnit();
            case 7 -> c.supplier();
            case 8 -> c.location();
            case 9 -> c.notes();
            default -> throw new IndexOutOfBoundsException("No column " + column);
        };
    }
}
