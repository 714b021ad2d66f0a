package com.gnucash.ledger.loader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Contents of an {@code act:slots}, {@code trn:slots} or {@code split:slots} block split into the
 * keys the caller recognises (as plain text values) and the raw text of every other slot.
 */
final class SlotBlock {
    private static final SlotBlock EMPTY = new SlotBlock(Map.of(), List.of());

    private final Map<String, String> known;
    private final List<String> extras;

    private SlotBlock(Map<String, String> known, List<String> extras) {
        this.known = known;
        this.extras = extras;
    }

    static SlotBlock read(String text, XmlElement slots, Set<String> knownKeys) throws LedgerParseException {
        if (slots == null) {
            return EMPTY;
        }
        Map<String, String> known = new LinkedHashMap<>();
        List<String> extras = new ArrayList<>();
        for (XmlElement slot : XmlScanner.children(text, slots)) {
            if (!"slot".equals(slot.getName())) {
                continue;
            }
            String key = XmlScanner.childText(text, slot, "slot:key");
            if (key != null && knownKeys.contains(key)) {
                XmlElement value = XmlScanner.child(text, slot, "slot:value");
                known.put(key, value == null ? "" : valueText(text, value));
            } else {
                extras.add(text.substring(slot.getStart(), slot.getEnd()));
            }
        }
        return new SlotBlock(Collections.unmodifiableMap(known), List.copyOf(extras));
    }

    String get(String key) {
        return known.get(key);
    }

    boolean isTrue(String key) {
        return "true".equalsIgnoreCase(known.get(key));
    }

    List<String> extras() {
        return extras;
    }

    private static String valueText(String text, XmlElement value) throws LedgerParseException {
        // gdate and frame values nest one more element; use its text for the former
        List<XmlElement> nested = XmlScanner.children(text, value);
        if (nested.size() == 1 && "gdate".equals(nested.get(0).getName())) {
            return XmlScanner.text(text, nested.get(0));
        }
        return XmlScanner.text(text, value);
    }
}
