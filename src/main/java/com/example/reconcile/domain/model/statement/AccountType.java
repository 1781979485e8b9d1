package com.example.reconcile.domain.model.statement;

import java.util.Locale;

/**
 * Kind of bank account a statement export belongs to.
 */
public enum AccountType {
    SAVINGS("savings"),
    CURRENT("current"),
    CREDIT_CARD("credit_card");

    private final String code;

    AccountType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

	/**
	 * Resolves an account type from its code or enum name, ignoring case.
	 *
	 * @param value raw value such as {@code credit_card} or {@code SAVINGS}
	 * @return matching account type
	 * @throws IllegalArgumentException when the value is unknown
	 */
    public static AccountType fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (AccountType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown account type: " + value);
    }
}
