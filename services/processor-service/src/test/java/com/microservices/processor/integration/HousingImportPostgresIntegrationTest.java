package com.microservices.processor.integration;

import com.microservices.processor.model.ImportResult;
import com.microservices.processor.repository.HousingPriceRepository;
import com.microservices.processor.service.HousingCsvParser;
import com.microservices.processor.service.HousingImportService;
import com.microservices.processor.service.JobMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Imports against a real PostgreSQL, which is the only database that runs the
 * {@code ON CONFLICT ... DO UPDATE} statement.
 */
@Testcontainers(disabledWithoutDocker = true)
class HousingImportPostgresIntegrationTest {

    private static final String HEADER = "tarih,istanbul_turkiye,yeni_yeni_olmayan_konut,fiyat_endeksi\n";

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    private JdbcTemplate jdbcTemplate;
    private HousingImportService importService;

    @BeforeEach
    void setUp() {
        var dataSource = new DriverManagerDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        jdbcTemplate = new JdbcTemplate(dataSource);

        var repository = new HousingPriceRepository(jdbcTemplate);
        repository.ensureSchema();
        jdbcTemplate.execute("TRUNCATE housing_price_index");

        importService = new HousingImportService(repository, new HousingCsvParser(),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)),
                new JobMetrics(new SimpleMeterRegistry()), 1000);
    }

    @Test
    void reimportingSameKey_overwritesIndexAndBumpsUpdatedAt() {
        importService.importCsv(HEADER + "2010-01-01,İstanbul,Yeni Konut,35.9\n");
        Timestamp firstUpdate = updatedAt();

        ImportResult second = importService.importCsv(HEADER + "2010-01-01,İstanbul,Yeni Konut,36.0\n");

        assertThat(second).isEqualTo(new ImportResult(1, 1));
        assertThat(rowCount()).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject("SELECT fiyat_endeksi FROM housing_price_index", BigDecimal.class))
                .isEqualByComparingTo("36.0");
        assertThat(updatedAt()).isAfterOrEqualTo(firstUpdate);
    }

    @Test
    void distinctRows_areAllInserted() throws IOException {
        String csv;
        try (InputStream in = getClass().getResourceAsStream("/housing/housing_price_index_sample.csv")) {
            csv = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        ImportResult result = importService.importCsv(csv);

        assertThat(result).isEqualTo(new ImportResult(8, 8));
        assertThat(rowCount()).isEqualTo(8);
    }

    @Test
    void repeatedKeyWithinOneImport_keepsLastValue() {
        ImportResult result = importService.importCsv(HEADER
                + "2010-01-01,İstanbul,Yeni Konut,35.9\n"
                + "2010-01-01,İstanbul,Yeni Konut,37.0\n");

        assertThat(result.rowsRead()).isEqualTo(2);
        assertThat(rowCount()).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject("SELECT fiyat_endeksi FROM housing_price_index", BigDecimal.class))
                .isEqualByComparingTo("37.0");
    }

    @Test
    void failingRow_rollsBackWholeImport() {
        importService.importCsv(HEADER + "2010-01-01,İstanbul,Yeni Konut,35.9\n");
        String tooLong = "x".repeat(60);

        assertThatThrownBy(() -> importService.importCsv(HEADER
                + "2010-01-01,İstanbul,Yeni Konut,40.0\n"
                + "2010-02-01,İstanbul,Yeni Konut,36.6\n"
                + "2010-03-01," + tooLong + ",Yeni Konut,37.1\n"))
                .isInstanceOf(DataAccessException.class);

        assertThat(rowCount()).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject("SELECT fiyat_endeksi FROM housing_price_index", BigDecimal.class))
                .isEqualByComparingTo("35.9");
    }

    private long rowCount() {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM housing_price_index", Long.class);
    }

    private Timestamp updatedAt() {
        return jdbcTemplate.queryForObject("SELECT updated_at FROM housing_price_index", Timestamp.class);
    }
}
