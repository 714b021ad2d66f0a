package com.gnucash.ledger.loader;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Element-boundary scanner for the small XML vocabulary of a GnuCash book. It finds the direct
 * children of a span, checks that tags nest, and skips comments, processing instructions and
 * CDATA sections. It is not a general XML parser: no DTDs, no namespace resolution.
 */
public final class XmlScanner {

    private XmlScanner() {}

    /** Direct child elements of the whole text. */
    public static List<XmlElement> children(String text) throws LedgerParseException {
        return children(text, 0, text.length());
    }

    /** Direct child elements of {@code parent}. */
    public static List<XmlElement> children(String text, XmlElement parent) throws LedgerParseException {
        if (parent.isSelfClosing()) {
            return List.of();
        }
        return children(text, parent.getContentStart(), parent.getContentEnd());
    }

    /** Direct child elements between {@code from} (inclusive) and {@code to} (exclusive). */
    public static List<XmlElement> children(String text, int from, int to) throws LedgerParseException {
        List<XmlElement> result = new ArrayList<>();
        Deque<String> open = new ArrayDeque<>();
        String topName = null;
        String topOpenTag = null;
        int topStart = -1;
        int topContentStart = -1;
        int pos = from;
        while (pos < to) {
            int lt = text.indexOf('<', pos);
            if (lt < 0 || lt >= to) {
                break;
            }
            if (text.startsWith("<!--", lt)) {
                pos = skipPast(text, lt, "-->", to);
                continue;
            }
            if (text.startsWith("<![CDATA[", lt)) {
                pos = skipPast(text, lt, "]]>", to);
                continue;
            }
            if (text.startsWith("<?", lt)) {
                pos = skipPast(text, lt, "?>", to);
                continue;
            }
            if (text.startsWith("<!", lt)) {
                pos = skipPast(text, lt, ">", to);
                continue;
            }
            int gt = tagEnd(text, lt, to);
            if (text.charAt(lt + 1) == '/') {
                String name = tagName(text, lt + 2, gt);
                String expected = open.pollLast();
                if (expected == null) {
                    throw new LedgerParseException("Unexpected closing tag </" + name + "> at offset " + lt);
                }
                if (!expected.equals(name)) {
                    throw new LedgerParseException(
                            "Mismatched closing tag </" + name + "> for <" + expected + "> at offset " + lt);
                }
                if (open.isEmpty()) {
                    result.add(new XmlElement(topName, topOpenTag, topStart, gt + 1, topContentStart, lt));
                }
                pos = gt + 1;
                continue;
            }
            String name = tagName(text, lt + 1, gt);
            boolean selfClosing = text.charAt(gt - 1) == '/';
            if (selfClosing) {
                if (open.isEmpty()) {
                    result.add(new XmlElement(name, text.substring(lt, gt + 1), lt, gt + 1, gt + 1, gt + 1));
                }
            } else {
                if (open.isEmpty()) {
                    topName = name;
                    topOpenTag = text.substring(lt, gt + 1);
                    topStart = lt;
                    topContentStart = gt + 1;
                }
                open.addLast(name);
            }
            pos = gt + 1;
        }
        if (!open.isEmpty()) {
            throw new LedgerParseException("Unclosed element <" + open.peekFirst() + "> at offset " + topStart);
        }
        return result;
    }

    /** First direct child called {@code name}, or null. */
    public static XmlElement child(String text, XmlElement parent, String name) throws LedgerParseException {
        for (XmlElement element : children(text, parent)) {
            if (element.getName().equals(name)) {
                return element;
            }
        }
        return null;
    }

    /** Trimmed, unescaped text of a direct child, or null when the child is absent. */
    public static String childText(String text, XmlElement parent, String name) throws LedgerParseException {
        XmlElement element = child(text, parent, name);
        return element == null ? null : text(text, element);
    }

    /** Trimmed, unescaped content of an element that holds only text. */
    public static String text(String text, XmlElement element) {
        if (element.isSelfClosing()) {
            return "";
        }
        String raw = text.substring(element.getContentStart(), element.getContentEnd());
        int cdata = raw.indexOf("<![CDATA[");
        if (cdata >= 0) {
            int close = raw.indexOf("]]>", cdata);
            if (close > cdata) {
                return raw.substring(cdata + 9, close).trim();
            }
        }
        return unescape(raw.trim());
    }

    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> builder.append("&amp;");
                case '<' -> builder.append("&lt;");
                case '>' -> builder.append("&gt;");
                case '"' -> builder.append("&quot;");
                default -> builder.append(c);
            }
        }
        return builder.toString();
    }

    public static String unescape(String value) {
        if (value == null || value.indexOf('&') < 0) {
            return value;
        }
        StringBuilder builder = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            int semi = c == '&' ? value.indexOf(';', i) : -1;
            if (semi < 0 || semi - i > 10) {
                builder.append(c);
                i++;
                continue;
            }
            String entity = value.substring(i + 1, semi);
            String replacement = decodeEntity(entity);
            if (replacement == null) {
                builder.append(c);
                i++;
            } else {
                builder.append(replacement);
                i = semi + 1;
            }
        }
        return builder.toString();
    }

    private static String decodeEntity(String entity) {
        switch (entity) {
            case "amp":
                return "&";
            case "lt":
                return "<";
            case "gt":
                return ">";
            case "quot":
                return "\"";
            case "apos":
                return "'";
            default:
                break;
        }
        if (entity.startsWith("#")) {
            try {
                int codePoint = entity.startsWith("#x") || entity.startsWith("#X")
                        ? Integer.parseInt(entity.substring(2), 16)
                        : Integer.parseInt(entity.substring(1));
                return new String(Character.toChars(codePoint));
            } catch (IllegalArgumentException ex) {
                return null;
            }
        }
        return null;
    }

    private static int skipPast(String text, int from, String terminator, int limit) throws LedgerParseException {
        int close = text.indexOf(terminator, from);
        if (close < 0 || close >= limit) {
            throw new LedgerParseException("Unterminated markup at offset " + from);
        }
        return close + terminator.length();
    }

    private static int tagEnd(String text, int lt, int limit) throws LedgerParseException {
        char quote = 0;
        for (int i = lt + 1; i < limit; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return i;
            }
        }
        throw new LedgerParseException("Unterminated tag at offset " + lt);
    }

    private static String tagName(String text, int from, int gt) throws LedgerParseException {
        int i = from;
        while (i < gt) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '/' || c == '>') {
                break;
            }
            i++;
        }
        if (i == from) {
            throw new LedgerParseException("Empty tag name at offset " + from);
        }
        return text.substring(from, i);
    }
}
