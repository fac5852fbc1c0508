package com.lazyframe.types;

import com.lazyframe.exception.SchemaException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Represents a struct type (row schema) with named fields.
 *
 * <p>This is the schema of every plan node and every columnar batch: an ordered
 * mapping from column name to data type. Field names are unique; constructing a
 * StructType with a repeated name raises {@link SchemaException}.
 */
public final class StructType implements DataType {

    /** Empty struct type with no fields. */
    public static final StructType EMPTY = new StructType(Collections.emptyList());

    private final List<StructField> fields;
    private final Map<String, Integer> indexByName;

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     * @throws SchemaException if two fields share a name
     */
    public StructType(List<StructField> fields) {
        this.fields = new ArrayList<>(Objects.requireNonNull(fields, "fields must not be null"));
        this.indexByName = new HashMap<>();
        for (int i = 0; i < this.fields.size(); i++) {
            String name = this.fields.get(i).name();
            if (indexByName.putIfAbsent(name, i) != null) {
                throw new SchemaException("duplicate column name '" + name + "'", null, null, name);
            }
        }
    }

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(StructField... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Returns the fields in this struct.
     *
     * @return an unmodifiable list of fields
     */
    public List<StructField> fields() {
        return Collections.unmodifiableList(fields);
    }

    /**
     * Returns the field names in order.
     *
     * @return the field names
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(fields.size());
        for (StructField field : fields) {
            names.add(field.name());
        }
        return names;
    }

    /**
     * Returns the number of fields in this struct.
     *
     * @return the field count
     */
    public int size() {
        return fields.size();
    }

    /**
     * Returns the field at the given index.
     *
     * @param index the field index
     * @return the field
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    /**
     * Returns the field with the given name, or null if not found.
     *
     * @param name the field name
     * @return the field, or null if not found
     */
    public StructField fieldByName(String name) {
        Integer index = indexByName.get(name);
        return index == null ? null : fields.get(index);
    }

    /**
     * Returns the field with the given name.
     *
     * @param name the field name
     * @return the field
     * @throws SchemaException if no such field exists
     */
    public StructField field(String name) {
        StructField field = fieldByName(name);
        if (field == null) {
            throw new SchemaException(
                "column '" + name + "' not found; available columns: " + names(), null, null, name);
        }
        return field;
    }

    /**
     * Returns the index of the field with the given name, or -1 if not found.
     *
     * @param name the field name
     * @return the field index, or -1 if not found
     */
    public int fieldIndex(String name) {
        Integer index = indexByName.get(name);
        return index == null ? -1 : index;
    }

    /**
     * Returns whether a field with the given name exists.
     *
     * @param name the field name
     * @return true if present
     */
    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    /**
     * Returns a schema with only the named fields, in the given order.
     *
     * @param names the names to keep
     * @return the projected schema
     * @throws SchemaException if a name is missing
     */
    public StructType select(List<String> names) {
        List<StructField> selected = new ArrayList<>(names.size());
        for (String name : names) {
            selected.add(field(name));
        }
        return new StructType(selected);
    }

    /**
     * Returns a schema with the given field appended, or replaced in place when a field
     * of the same name already exists.
     *
     * @param field the field to add
     * @return the new schema
     */
    public StructType withField(StructField field) {
        List<StructField> result = new ArrayList<>(fields);
        int index = fieldIndex(field.name());
        if (index >= 0) {
            result.set(index, field);
        } else {
            result.add(field);
        }
        return new StructType(result);
    }

    @Override
    public String typeName() {
        return "struct";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructType that = (StructType) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "StructType(" + fields + ")";
    }
}
