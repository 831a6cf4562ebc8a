package com.sessionhub.ingestion.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A parsed spreadsheet cell: nothing, a literal string, a list or an object.
 */
public final class CellValue {

    public enum Kind {
        NULL,
        TEXT,
        LIST,
        OBJECT
    }

    private static final CellValue NULL_VALUE = new CellValue(Kind.NULL, null, null, null);

    private final Kind kind;
    private final String text;
    private final List<Object> list;
    private final Map<String, Object> object;

    private CellValue(Kind kind, String text, List<Object> list, Map<String, Object> object) {
        this.kind = kind;
        this.text = text;
        this.list = list;
        this.object = object;
    }

    public static CellValue empty() {
        return NULL_VALUE;
    }

    public static CellValue text(String text) {
        return new CellValue(Kind.TEXT, text, null, null);
    }

    public static CellValue list(List<Object> list) {
        return new CellValue(Kind.LIST, null, Collections.unmodifiableList(list), null);
    }

    public static CellValue object(Map<String, Object> object) {
        return new CellValue(Kind.OBJECT, null, null, Collections.unmodifiableMap(object));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public String getText() {
        return text;
    }

    public List<Object> getList() {
        return list;
    }

    public Map<String, Object> getObject() {
        return object;
    }

    /**
     * Plain Java form for metadata maps: null, String, List or Map.
     */
    public Object toPlainValue() {
        switch (kind) {
            case TEXT:
                return text;
            case LIST:
                return list;
            case OBJECT:
                return object;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return kind + ":" + toPlainValue();
    }
}
