package com.gnucash.ledger.ledger;

import java.util.List;
import java.util.Objects;

/**
 * One {@code gnc:account} block. Accounts form a tree through {@link #getParentId()}; the single
 * {@link AccountType#ROOT} account has no parent.
 */
public final class Account {
    public static final String DEFAULT_COMMODITY_SPACE = "CURRENCY";
    public static final String DEFAULT_COMMODITY = "USD";
    public static final int DEFAULT_COMMODITY_SCU = 100;

    private final String id;
    private final String name;
    private final AccountType type;
    private final String parentId;
    private final String description;
    private final boolean placeholder;
    private final boolean hidden;
    private final String commoditySpace;
    private final String commodityId;
    private final Integer commodityScu;
    private final List<String> extraSlots;

    public Account(
            String id,
            String name,
            AccountType type,
            String parentId,
            String description,
            boolean placeholder,
            boolean hidden,
            String commoditySpace,
            String commodityId,
            Integer commodityScu,
            List<String> extraSlots) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? "" : name;
        this.type = Objects.requireNonNull(type, "type");
        this.parentId = parentId;
        this.description = description == null ? "" : description;
        this.placeholder = placeholder;
        this.hidden = hidden;
        this.commoditySpace = commoditySpace;
        this.commodityId = commodityId;
        this.commodityScu = commodityScu;
        this.extraSlots = extraSlots == null ? List.of() : List.copyOf(extraSlots);
    }

    /** Account in the default currency with no extra metadata. */
    public static Account of(
            String id, String name, AccountType type, String parentId, String description, boolean placeholder) {
        if (type == AccountType.ROOT) {
            return new Account(id, name, type, null, description, false, false, null, null, null, List.of());
        }
        return new Account(
                id,
                name,
                type,
                parentId,
                description,
                placeholder,
                false,
                DEFAULT_COMMODITY_SPACE,
                DEFAULT_COMMODITY,
                DEFAULT_COMMODITY_SCU,
                List.of());
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public AccountType getType() {
        return type;
    }

    public String getParentId() {
        return parentId;
    }

    public String getDescription() {
        return description;
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    public boolean isHidden() {
        return hidden;
    }

    public String getCommoditySpace() {
        return commoditySpace;
    }

    public String getCommodityId() {
        return commodityId;
    }

    public Integer getCommodityScu() {
        return commodityScu;
    }

    /** Raw text of metadata slots this library does not interpret, written back verbatim. */
    public List<String> getExtraSlots() {
        return extraSlots;
    }

    public Account withName(String newName) {
        return new Account(
                id, newName, type, parentId, description, placeholder, hidden,
                commoditySpace, commodityId, commodityScu, extraSlots);
    }

    public Account withParentId(String newParentId) {
        return new Account(
                id, name, type, newParentId, description, placeholder, hidden,
                commoditySpace, commodityId, commodityScu, extraSlots);
    }

    public Account withHidden(boolean newHidden) {
        return new Account(
                id, name, type, parentId, description, placeholder, newHidden,
                commoditySpace, commodityId, commodityScu, extraSlots);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Account other)) {
            return false;
        }
        return placeholder == other.placeholder
                && hidden == other.hidden
                && id.equals(other.id)
                && name.equals(other.name)
                && type == other.type
                && Objects.equals(parentId, other.parentId)
                && description.equals(other.description)
                && Objects.equals(commoditySpace, other.commoditySpace)
                && Objects.equals(commodityId, other.commodityId)
                && Objects.equals(commodityScu, other.commodityScu)
                && extraSlots.equals(other.extraSlots);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, parentId);
    }

    @Override
    public String toString() {
        return "Account{" + id + " '" + name + "' " + type + (placeholder ? " placeholder" : "") + "}";
    }
}
