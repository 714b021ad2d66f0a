package com.gnucash.ledger.loader;

import java.util.Objects;

/**
 * Span of one element inside the raw document text. Offsets index the text the element was
 * scanned from; nothing is copied until a caller asks for it.
 */
public final class XmlElement {
    private final String name;
    private final String openTag;
    private final int start;
    private final int end;
    private final int contentStart;
    private final int contentEnd;

    XmlElement(String name, String openTag, int start, int end, int contentStart, int contentEnd) {
        this.name = Objects.requireNonNull(name, "name");
        this.openTag = openTag;
        this.start = start;
        this.end = end;
        this.contentStart = contentStart;
        this.contentEnd = contentEnd;
    }

    public String getName() {
        return name;
    }

    /** Offset of the opening {@code <}. */
    public int getStart() {
        return start;
    }

    /** Offset just past the closing {@code >}. */
    public int getEnd() {
        return end;
    }

    public int getContentStart() {
        return contentStart;
    }

    public int getContentEnd() {
        return contentEnd;
    }

    public boolean isSelfClosing() {
        return contentStart == end;
    }

    /** Value of an attribute on the opening tag, or null. */
    public String attribute(String attributeName) {
        String marker = attributeName + "=";
        int index = openTag.indexOf(marker);
        while (index > 0 && !Character.isWhitespace(openTag.charAt(index - 1))) {
            index = openTag.indexOf(marker, index + 1);
        }
        if (index < 0) {
            return null;
        }
        int valueStart = index + marker.length();
        if (valueStart >= openTag.length()) {
            return null;
        }
        char quote = openTag.charAt(valueStart);
        if (quote != '"' && quote != '\'') {
            return null;
        }
        int valueEnd = openTag.indexOf(quote, valueStart + 1);
        return valueEnd < 0 ? null : XmlScanner.unescape(openTag.substring(valueStart + 1, valueEnd));
    }

    @Override
    public String toString() {
        return "<" + name + ">[" + start + "," + end + ")";
    }
}
