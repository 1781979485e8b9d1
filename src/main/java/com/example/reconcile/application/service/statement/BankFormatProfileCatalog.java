package com.example.reconcile.application.service.statement;

import com.example.reconcile.application.exception.BankProfileNotFoundException;
import com.example.reconcile.domain.model.statement.AccountType;
import com.example.reconcile.domain.model.statement.BankFormatProfile;
import com.example.reconcile.domain.model.statement.StatementFileFormat;
import com.example.reconcile.infrastructure.config.BankProfileProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Application-layer lookup of the bank format profiles declared in configuration.
 */
@Service
public class BankFormatProfileCatalog {

    private static final Logger log = LoggerFactory.getLogger(BankFormatProfileCatalog.class);

    private final List<BankFormatProfile> profiles;

    public BankFormatProfileCatalog(BankProfileProperties properties) {
        this.profiles = properties.bankProfiles().stream()
                .map(BankProfileProperties.ProfileEntry::toProfile)
                .toList();
        log.info("Loaded {} bank format profiles.", profiles.size());
    }

    /**
     * Finds the profile for a bank and account type. A profile declared for the exact file format is
     * preferred over one that accepts any format.
     *
     * @param bankCode    bank identifier, case-insensitive
     * @param accountType account type
     * @param format      format of the file at hand, may be {@code null}
     * @return matching profile
     */
    public Optional<BankFormatProfile> find(String bankCode, AccountType accountType, StatementFileFormat format) {
        if (bankCode == null || accountType == null) {
            return Optional.empty();
        }
        String code = bankCode.trim().toLowerCase(Locale.ROOT);
        List<BankFormatProfile> candidates = profiles.stream()
                .filter(profile -> profile.bankCode().equals(code) && profile.accountType() == accountType)
                .toList();
        return candidates.stream()
                .filter(profile -> format != null && profile.fileFormat() == format)
                .findFirst()
                .or(() -> candidates.stream().filter(profile -> profile.fileFormat() == null).findFirst())
                .or(() -> candidates.stream().findFirst());
    }

    /**
     * Same as {@link #find(String, AccountType, StatementFileFormat)} but fails when nothing matches.
     *
     * @param bankCode    bank identifier
     * @param accountType account type
     * @param format      file format, may be {@code null}
     * @return matching profile
     * @throws BankProfileNotFoundException when no profile is configured
     */
    public BankFormatProfile require(String bankCode, AccountType accountType, StatementFileFormat format) {
        return find(bankCode, accountType, format)
                .orElseThrow(() -> new BankProfileNotFoundException(bankCode,
                        accountType == null ? null : accountType.code()));
    }

    public List<BankFormatProfile> profiles() {
        return profiles;
    }
}
