package com.householdledger.recurring.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;

class DatabaseBootstrapTest {

    @Test
    void splitsSchemaIntoTrimmedStatements() {
        String sql = """
                create extension if not exists pgcrypto;

                create table transaction_log (id uuid primary key);
                create index idx_transaction_log_date on transaction_log(date);
                ;
                """;

        List<String> statements = DatabaseBootstrap.splitStatements(sql);

        assertThat(statements).containsExactly(
                "create extension if not exists pgcrypto",
                "create table transaction_log (id uuid primary key)",
                "create index idx_transaction_log_date on transaction_log(date)"
        );
    }

    @Test
    void recognisesExtensionStatementsRegardlessOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            // Turkish lowercases 'I' to a dotless i
            Locale.setDefault(new Locale("tr", "TR"));

            assertThat(DatabaseBootstrap.isExtensionStatement("CREATE EXTENSION IF NOT EXISTS \"uuid-ossp\"")).isTrue();
            assertThat(DatabaseBootstrap.isExtensionStatement("CREATE TABLE recurring_payments (id uuid)")).isFalse();
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void disabledBootstrapNeverTouchesTheDatabase() {
        DataSource dataSource = mock(DataSource.class);
        RecurringProperties properties = new RecurringProperties(
                new RecurringProperties.Currency("GBP", new BigDecimal("1.25")),
                null,
                new RecurringProperties.Db(false)
        );

        new DatabaseBootstrap(dataSource, properties).maybeBootstrap();

        verifyNoInteractions(dataSource);
    }
}
