package com.microservices.processor.repository;

import com.microservices.processor.model.HousingFilter;
import com.microservices.processor.model.HousingPriceRecord;
import com.microservices.processor.model.HousingPriceRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to {@code housing_price_index}.
 * <p>
 * Rows are keyed by (tarih, istanbul_turkiye, yeni_yeni_olmayan_konut). Writes go through
 * {@code INSERT ... ON CONFLICT DO UPDATE}, so a repeated key overwrites the index value
 * and bumps {@code updated_at}; the last write wins.
 */
@Repository
public class HousingPriceRepository {

    private static final Logger log = LoggerFactory.getLogger(HousingPriceRepository.class);

    static final String UPSERT_SQL = """
            INSERT INTO housing_price_index
                (tarih, istanbul_turkiye, yeni_yeni_olmayan_konut, fiyat_endeksi)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (tarih, istanbul_turkiye, yeni_yeni_olmayan_konut)
            DO UPDATE SET
                fiyat_endeksi = EXCLUDED.fiyat_endeksi,
                updated_at = CURRENT_TIMESTAMP
            """;

    private static final String SELECT_COLUMNS = """
            SELECT id, tarih, istanbul_turkiye, yeni_yeni_olmayan_konut, fiyat_endeksi, created_at, updated_at
            FROM housing_price_index
            """;

    private static final String SERIES_FILTER = " WHERE istanbul_turkiye = ? AND yeni_yeni_olmayan_konut = ?";

    private static final RowMapper<HousingPriceRecord> ROW_MAPPER = HousingPriceRepository::mapRow;

    private final JdbcTemplate jdbcTemplate;

    private volatile boolean schemaReady;

    public HousingPriceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates the table and its lookup indexes if they are missing. Calls are serialized
     * and become no-ops once the schema has been created by this process.
     */
    public synchronized void ensureSchema() {
        if (schemaReady) {
            return;
        }

        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS housing_price_index (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    tarih DATE NOT NULL,
                    istanbul_turkiye VARCHAR(50) NOT NULL,
                    yeni_yeni_olmayan_konut VARCHAR(50) NOT NULL,
                    fiyat_endeksi DECIMAL(10, 2) NOT NULL,
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                    updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                    UNIQUE (tarih, istanbul_turkiye, yeni_yeni_olmayan_konut)
                )
                """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_housing_tarih ON housing_price_index (tarih)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_housing_location ON housing_price_index (istanbul_turkiye)");

        schemaReady = true;
        log.info("Table housing_price_index created or already exists");
    }

    /**
     * Upserts rows in file order, one statement per row, sent in JDBC batches.
     *
     * @return the sum of the update counts reported by the driver
     */
    public int upsertAll(List<HousingPriceRow> rows, int batchSize) {
        if (rows.isEmpty()) {
            return 0;
        }

        int[][] counts = jdbcTemplate.batchUpdate(UPSERT_SQL, rows, batchSize, (ps, row) -> {
            ps.setObject(1, row.date());
            ps.setString(2, row.location());
            ps.setString(3, row.housingType());
            ps.setBigDecimal(4, BigDecimal.valueOf(row.priceIndex()));
        });

        int affected = 0;
        for (int[] batch : counts) {
            for (int count : batch) {
                // SUCCESS_NO_INFO (-2) carries no row count
                if (count > 0) {
                    affected += count;
                }
            }
        }
        return affected;
    }

    public List<HousingPriceRecord> findAll(HousingFilter filter) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE 1=1");
        List<Object> args = new ArrayList<>();

        if (filter.location() != null) {
            sql.append(" AND istanbul_turkiye = ?");
            args.add(filter.location());
        }
        if (filter.housingType() != null) {
            sql.append(" AND yeni_yeni_olmayan_konut = ?");
            args.add(filter.housingType());
        }
        if (filter.startDate() != null) {
            sql.append(" AND tarih >= ?");
            args.add(filter.startDate());
        }
        if (filter.endDate() != null) {
            sql.append(" AND tarih <= ?");
            args.add(filter.endDate());
        }

        sql.append(" ORDER BY tarih DESC, istanbul_turkiye, yeni_yeni_olmayan_konut");

        return jdbcTemplate.query(sql.toString(), ROW_MAPPER, args.toArray());
    }

    // Series lookups for the KPI endpoint

    public Optional<HousingPriceRecord> findLatest(String location, String housingType) {
        return first(SELECT_COLUMNS + SERIES_FILTER + " ORDER BY tarih DESC LIMIT 1", location, housingType);
    }

    public Optional<HousingPriceRecord> findEarliest(String location, String housingType) {
        return first(SELECT_COLUMNS + SERIES_FILTER + " ORDER BY tarih ASC LIMIT 1", location, housingType);
    }

    public Optional<HousingPriceRecord> findLatestOnOrBefore(String location, String housingType, LocalDate date) {
        return first(SELECT_COLUMNS + SERIES_FILTER + " AND tarih <= ? ORDER BY tarih DESC LIMIT 1",
                location, housingType, date);
    }

    public Optional<double[]> findMinMax(String location, String housingType) {
        List<double[]> rows = jdbcTemplate.query("""
                SELECT MIN(fiyat_endeksi) AS min_value, MAX(fiyat_endeksi) AS max_value
                FROM housing_price_index
                """ + SERIES_FILTER,
                (rs, rowNum) -> {
                    BigDecimal min = rs.getBigDecimal("min_value");
                    BigDecimal max = rs.getBigDecimal("max_value");
                    return min == null || max == null ? null : new double[]{min.doubleValue(), max.doubleValue()};
                },
                location, housingType);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    private Optional<HousingPriceRecord> first(String sql, Object... args) {
        return jdbcTemplate.query(sql, ROW_MAPPER, args).stream().findFirst();
    }

    private static HousingPriceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new HousingPriceRecord(
                rs.getLong("id"),
                rs.getObject("tarih", LocalDate.class),
                rs.getString("istanbul_turkiye"),
                rs.getString("yeni_yeni_olmayan_konut"),
                rs.getBigDecimal("fiyat_endeksi").doubleValue(),
                rs.getObject("created_at", LocalDateTime.class),
                rs.getObject("updated_at", LocalDateTime.class)
        );
    }
}
