package com.gnucash.ledger.loader;

/** Element and slot names of the GnuCash XML v2 book that this library reads and writes. */
public final class GncTags {
    public static final String ROOT = "gnc-v2";
    public static final String BOOK = "gnc:book";
    public static final String COUNT_DATA = "gnc:count-data";
    public static final String COUNT_TYPE_ATTRIBUTE = "cd:type";
    public static final String ACCOUNT = "gnc:account";
    public static final String TRANSACTION = "gnc:transaction";

    public static final String ACT_NAME = "act:name";
    public static final String ACT_ID = "act:id";
    public static final String ACT_TYPE = "act:type";
    public static final String ACT_COMMODITY = "act:commodity";
    public static final String ACT_COMMODITY_SCU = "act:commodity-scu";
    public static final String ACT_DESCRIPTION = "act:description";
    public static final String ACT_SLOTS = "act:slots";
    public static final String ACT_PARENT = "act:parent";

    public static final String CMDTY_SPACE = "cmdty:space";
    public static final String CMDTY_ID = "cmdty:id";

    public static final String TRN_ID = "trn:id";
    public static final String TRN_CURRENCY = "trn:currency";
    public static final String TRN_NUM = "trn:num";
    public static final String TRN_DATE_POSTED = "trn:date-posted";
    public static final String TRN_DATE_ENTERED = "trn:date-entered";
    public static final String TRN_DESCRIPTION = "trn:description";
    public static final String TRN_SLOTS = "trn:slots";
    public static final String TRN_SPLITS = "trn:splits";
    public static final String TRN_SPLIT = "trn:split";
    public static final String TS_DATE = "ts:date";

    public static final String SPLIT_ID = "split:id";
    public static final String SPLIT_MEMO = "split:memo";
    public static final String SPLIT_ACTION = "split:action";
    public static final String SPLIT_RECONCILED_STATE = "split:reconciled-state";
    public static final String SPLIT_RECONCILE_DATE = "split:reconcile-date";
    public static final String SPLIT_VALUE = "split:value";
    public static final String SPLIT_QUANTITY = "split:quantity";
    public static final String SPLIT_ACCOUNT = "split:account";
    public static final String SPLIT_SLOTS = "split:slots";

    public static final String SLOT_PLACEHOLDER = "placeholder";
    public static final String SLOT_HIDDEN = "hidden";
    public static final String SLOT_NOTES = "notes";
    public static final String SLOT_DATE_POSTED = "date-posted";
    public static final String SLOT_ONLINE_ID = "online_id";

    public static final String COUNT_ACCOUNT = "account";
    public static final String COUNT_TRANSACTION = "transaction";

    private GncTags() {}
}
