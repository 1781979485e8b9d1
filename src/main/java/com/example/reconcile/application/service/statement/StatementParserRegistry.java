package com.example.reconcile.application.service.statement;

import com.example.reconcile.application.service.statement.parser.GenericStatementParser;
import com.example.reconcile.application.service.statement.parser.StatementParser;
import com.example.reconcile.domain.model.statement.BankFormatProfile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Looks up the parser for a profile by key: explicit parser key, then {@code <bank>_<accountType>},
 * then the generic parser.
 */
@Component
public class StatementParserRegistry {

    private static final Logger log = LoggerFactory.getLogger(StatementParserRegistry.class);

    private final Map<String, StatementParser> parsers = new LinkedHashMap<>();

    public StatementParserRegistry(List<StatementParser> parsers) {
        for (StatementParser parser : parsers) {
            StatementParser previous = this.parsers.putIfAbsent(parser.key(), parser);
            if (previous != null) {
                throw new IllegalStateException("Duplicate statement parser key: " + parser.key());
            }
        }
        if (!this.parsers.containsKey(GenericStatementParser.KEY)) {
            throw new IllegalStateException("A generic statement parser must be registered");
        }
    }

    /**
     * Picks the parser responsible for a profile.
     *
     * @param profile statement layout
     * @return dedicated parser or the generic fallback
     */
    public StatementParser resolve(BankFormatProfile profile) {
        StatementParser parser = parsers.get(profile.parserKey());
        if (parser != null) {
            return parser;
        }
        log.info("No dedicated parser for '{}', using the generic parser.", profile.parserKey());
        return parsers.get(GenericStatementParser.KEY);
    }

    public Set<String> keys() {
        return parsers.keySet();
    }
}
