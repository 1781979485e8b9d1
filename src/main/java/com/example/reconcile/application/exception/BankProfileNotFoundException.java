package com.example.reconcile.application.exception;

/**
 * Raised when no configured bank format profile matches the requested bank and account type.
 */
public class BankProfileNotFoundException extends UseCaseValidationException {

	/**
	 * @param bankCode    requested bank
	 * @param accountType requested account type
	 */
    public BankProfileNotFoundException(String bankCode, String accountType) {
        super("No statement format profile configured for bank '" + bankCode + "' and account type '" + accountType + "'.");
    }
}
