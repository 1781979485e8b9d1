package com.example.reconcile.domain.model.statement;

import java.util.Locale;

/**
 * Logical statement columns a {@link BankFormatProfile} maps onto the physical headers of an export.
 */
public enum StatementField {
    DATE("date"),
    VALUE_DATE("value_date"),
    NARRATION("narration"),
    REFERENCE("reference"),
    AMOUNT("amount"),
    WITHDRAWAL("withdrawal"),
    DEPOSIT("deposit"),
    BALANCE("balance"),
    CR_DR("cr_dr"),
    BILLING_SIGN("billing_sign"),
    INTERNATIONAL_AMOUNT("international_amount"),
    REWARD_POINTS("reward_points");

    private final String key;

    StatementField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

	/**
	 * Looks up a field by its configuration key. Accepts {@code description} as an alias of narration.
	 *
	 * @param key configuration key, case-insensitive
	 * @return matching field
	 * @throws IllegalArgumentException when no field uses the key
	 */
    public static StatementField fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Column key is required");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("description".equals(normalized)) {
            return NARRATION;
        }
        for (StatementField field : values()) {
            if (field.key.equals(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown statement column key: " + key);
    }
}
