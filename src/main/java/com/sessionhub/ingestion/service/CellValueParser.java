package com.sessionhub.ingestion.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionhub.ingestion.model.CellValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Interprets loosely typed cell text. Bracket-delimited cells go through
 * strict JSON, then JSON with single quotes swapped for double quotes, then fall back to the literal text.
 */
@Component
public class CellValueParser {

    private static final Logger logger = LoggerFactory.getLogger(CellValueParser.class);

    private final ObjectMapper objectMapper;

    public CellValueParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses one raw cell. Never throws.
     */
    public CellValue parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return CellValue.empty();
        }
        String trimmed = raw.trim();
        if (!looksStructured(trimmed)) {
            return CellValue.text(trimmed);
        }
        Object decoded = tryDecode(trimmed);
        if (decoded == null) {
            decoded = tryDecode(trimmed.replace('\'', '"'));
        }
        if (decoded instanceof List) {
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) decoded;
            return CellValue.list(list);
        }
        if (decoded instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) decoded;
            return CellValue.object(map);
        }
        return CellValue.text(trimmed);
    }

    /**
     * Normalizes a list-typed cell: a decoded array wins, then a comma split, then a single element.
     * Empty cells give an empty list.
     */
    public List<String> parseStringList(String raw) {
        return toStringList(parse(raw));
    }

    public List<String> toStringList(CellValue value) {
        switch (value.getKind()) {
            case LIST: {
                List<String> items = new ArrayList<>();
                for (Object element : value.getList()) {
                    if (element == null) {
                        continue;
                    }
                    String item = String.valueOf(element).trim();
                    if (!item.isEmpty()) {
                        items.add(item);
                    }
                }
                return items;
            }
            case TEXT: {
                String text = value.getText();
                if (!text.contains(",")) {
                    return new ArrayList<>(List.of(text));
                }
                List<String> items = new ArrayList<>();
                for (String part : text.split(",")) {
                    String item = part.trim();
                    if (!item.isEmpty()) {
                        items.add(item);
                    }
                }
                return items;
            }
            case OBJECT:
                return new ArrayList<>(List.of(String.valueOf(value.getObject())));
            default:
                return Collections.emptyList();
        }
    }

    /**
     * Decodes a JSON array of objects, or returns an empty list if the cell is not one.
     */
    public <T> List<T> parseObjectList(String raw, TypeReference<List<T>> type) {
        CellValue value = parse(raw);
        if (value.getKind() != CellValue.Kind.LIST) {
            return Collections.emptyList();
        }
        JavaType elementType = objectMapper.getTypeFactory().constructType(type).getContentType();
        List<T> mapped = new ArrayList<>();
        for (Object element : value.getList()) {
            try {
                T item = objectMapper.convertValue(element, elementType);
                mapped.add(item);
            } catch (IllegalArgumentException e) {
                logger.debug("Skipping cell list element that could not be mapped to {}: {}",
                        elementType, e.getMessage());
            }
        }
        return mapped;
    }

    private boolean looksStructured(String value) {
        return (value.startsWith("[") && value.endsWith("]"))
                || (value.startsWith("{") && value.endsWith("}"));
    }

    private Object tryDecode(String value) {
        try {
            return objectMapper.readValue(value, Object.class);
        } catch (JsonProcessingException e) {
            logger.debug("Cell is not valid JSON ({}), trying next form", e.getOriginalMessage());
            return null;
        }
    }
}
