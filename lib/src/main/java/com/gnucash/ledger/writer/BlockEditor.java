package com.gnucash.ledger.writer;

import com.gnucash.ledger.loader.GncTags;
import com.gnucash.ledger.loader.LedgerParseException;
import com.gnucash.ledger.loader.LedgerReader;
import com.gnucash.ledger.loader.XmlElement;
import com.gnucash.ledger.loader.XmlScanner;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Text-level edits on the decompressed book. Blocks are located by scanning the direct children
 * of {@code <gnc:book>} and comparing their id element, so nested template transactions never
 * match. Every method returns the new text; the input is left untouched.
 */
public final class BlockEditor {

    private static final Logger LOGGER = Logger.getLogger(BlockEditor.class.getName());

    private BlockEditor() {}

    /** The {@code gnc:account} block whose {@code act:id} is {@code id}, or null. */
    public static XmlElement findAccount(String xml, String id) throws LedgerParseException {
        return findBlock(xml, GncTags.ACCOUNT, GncTags.ACT_ID, id);
    }

    /** The {@code gnc:transaction} block whose {@code trn:id} is {@code id}, or null. */
    public static XmlElement findTransaction(String xml, String id) throws LedgerParseException {
        return findBlock(xml, GncTags.TRANSACTION, GncTags.TRN_ID, id);
    }

    public static String replace(String xml, XmlElement block, String replacement) {
        return xml.substring(0, block.getStart()) + replacement + xml.substring(block.getEnd());
    }

    /** Removes {@code block} together with its indentation and the line break after it. */
    public static String remove(String xml, XmlElement block) {
        int start = block.getStart();
        while (start > 0 && (xml.charAt(start - 1) == ' ' || xml.charAt(start - 1) == '\t')) {
            start--;
        }
        boolean lineStart = start == 0 || xml.charAt(start - 1) == '\n';
        if (!lineStart) {
            start = block.getStart();
        }
        int end = block.getEnd();
        if (lineStart) {
            if (end < xml.length() && xml.charAt(end) == '\r') {
                end++;
            }
            if (end < xml.length() && xml.charAt(end) == '\n') {
                end++;
            }
        }
        return xml.substring(0, start) + xml.substring(end);
    }

    /** Inserts an account block before the first transaction, or at the end of the book. */
    public static String insertAccount(String xml, String accountBlock) throws LedgerParseException {
        XmlElement book = LedgerReader.findBook(xml);
        for (XmlElement element : XmlScanner.children(xml, book)) {
            if (GncTags.TRANSACTION.equals(element.getName())) {
                return insertAt(xml, element.getStart(), accountBlock);
            }
        }
        return insertAt(xml, book.getContentEnd(), accountBlock);
    }

    /** Appends a transaction block at the end of the book. */
    public static String insertTransaction(String xml, String transactionBlock) throws LedgerParseException {
        XmlElement book = LedgerReader.findBook(xml);
        return insertAt(xml, book.getContentEnd(), transactionBlock);
    }

    /** Replaces only the {@code act:name} element of {@code accountBlock}. */
    public static String renameAccount(String xml, XmlElement accountBlock, String newName)
            throws LedgerParseException {
        String nameElement = "<" + GncTags.ACT_NAME + ">" + XmlScanner.escape(newName) + "</" + GncTags.ACT_NAME + ">";
        XmlElement current = XmlScanner.child(xml, accountBlock, GncTags.ACT_NAME);
        if (current == null) {
            return xml.substring(0, accountBlock.getContentStart())
                    + "\n  " + nameElement
                    + xml.substring(accountBlock.getContentStart());
        }
        return replace(xml, current, nameElement);
    }

    /** Current value of the {@code gnc:count-data} counter of {@code type}, or 0 when absent. */
    public static int count(String xml, String type) throws LedgerParseException {
        XmlElement counter = findCounter(xml, LedgerReader.findBook(xml), type);
        if (counter == null) {
            return 0;
        }
        return parseCount(xml, counter, type);
    }

    /**
     * Adds {@code delta} to the counter of {@code type}. A missing counter is created after the
     * last existing one, but only when the result would be positive.
     */
    public static String adjustCount(String xml, String type, int delta) throws LedgerParseException {
        XmlElement book = LedgerReader.findBook(xml);
        XmlElement counter = findCounter(xml, book, type);
        if (counter != null) {
            int updated = Math.max(0, parseCount(xml, counter, type) + delta);
            return xml.substring(0, counter.getContentStart()) + updated + xml.substring(counter.getContentEnd());
        }
        if (delta <= 0) {
            LOGGER.log(Level.WARNING, "No count-data counter for {0}; leaving counts unchanged", type);
            return xml;
        }
        String created = "<" + GncTags.COUNT_DATA + " " + GncTags.COUNT_TYPE_ATTRIBUTE + "=\"" + type + "\">"
                + delta + "</" + GncTags.COUNT_DATA + ">";
        XmlElement anchor = null;
        for (XmlElement element : XmlScanner.children(xml, book)) {
            if (GncTags.COUNT_DATA.equals(element.getName()) || "book:id".equals(element.getName())) {
                anchor = element;
            }
        }
        if (anchor == null) {
            return xml.substring(0, book.getContentStart()) + "\n" + created + xml.substring(book.getContentStart());
        }
        return xml.substring(0, anchor.getEnd()) + "\n" + created + xml.substring(anchor.getEnd());
    }

    private static XmlElement findBlock(String xml, String blockName, String idName, String id)
            throws LedgerParseException {
        XmlElement book = LedgerReader.findBook(xml);
        for (XmlElement element : XmlScanner.children(xml, book)) {
            if (blockName.equals(element.getName()) && id.equals(XmlScanner.childText(xml, element, idName))) {
                return element;
            }
        }
        return null;
    }

    private static XmlElement findCounter(String xml, XmlElement book, String type) throws LedgerParseException {
        List<XmlElement> children = XmlScanner.children(xml, book);
        for (XmlElement element : children) {
            if (GncTags.COUNT_DATA.equals(element.getName())
                    && type.equals(element.attribute(GncTags.COUNT_TYPE_ATTRIBUTE))) {
                return element;
            }
        }
        return null;
    }

    private static int parseCount(String xml, XmlElement counter, String type) throws LedgerParseException {
        String value = XmlScanner.text(xml, counter);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new LedgerParseException("Malformed count-data for " + type + ": '" + value + "'", ex);
        }
    }

    private static String insertAt(String xml, int offset, String block) {
        return xml.substring(0, offset) + block + "\n" + xml.substring(offset);
    }
}
