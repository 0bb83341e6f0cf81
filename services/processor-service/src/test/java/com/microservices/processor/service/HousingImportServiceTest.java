package com.microservices.processor.service;

import com.microservices.processor.model.HousingPriceRow;
import com.microservices.processor.model.ImportResult;
import com.microservices.processor.repository.HousingPriceRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HousingImportServiceTest {

    private static final String CSV = """
            tarih,istanbul_turkiye,yeni_yeni_olmayan_konut,fiyat_endeksi
            2010-01-01,İstanbul,Yeni Konut,35.9
            2010-02-01,İstanbul,Yeni Konut,36.6
            """;

    @Mock
    private HousingPriceRepository housingPriceRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry registry;
    private HousingImportService importService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        importService = new HousingImportService(housingPriceRepository, new HousingCsvParser(),
                new TransactionTemplate(transactionManager), new JobMetrics(registry), 500);
    }

    @Test
    void importCsv_upsertsAllRowsInOneTransaction() {
        when(housingPriceRepository.upsertAll(anyList(), eq(500))).thenReturn(2);

        ImportResult result = importService.importCsv(CSV);

        assertThat(result).isEqualTo(new ImportResult(2, 2));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<HousingPriceRow>> rows = ArgumentCaptor.forClass(List.class);
        InOrder order = inOrder(housingPriceRepository, transactionManager);
        order.verify(housingPriceRepository).ensureSchema();
        order.verify(transactionManager).getTransaction(any());
        order.verify(housingPriceRepository).upsertAll(rows.capture(), eq(500));
        order.verify(transactionManager).commit(any());

        assertThat(rows.getValue()).extracting(HousingPriceRow::priceIndex).containsExactly(35.9, 36.6);
        assertThat(registry.get("housing.import.rows.total").tag("kind", "read").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void importCsv_reportsDriverCountSeparatelyFromRowsRead() {
        when(housingPriceRepository.upsertAll(anyList(), anyInt())).thenReturn(0);

        ImportResult result = importService.importCsv(CSV);

        assertThat(result.rowsRead()).isEqualTo(2);
        assertThat(result.rowsAffected()).isZero();
    }

    @Test
    void importCsv_blankInput_isNoOp() {
        ImportResult result = importService.importCsv("   ");

        assertThat(result).isEqualTo(ImportResult.empty());
        verify(housingPriceRepository).ensureSchema();
        verify(housingPriceRepository, never()).upsertAll(anyList(), anyInt());
    }

    @Test
    void importCsv_headerOnly_writesNothing() {
        ImportResult result = importService.importCsv(
                "tarih,istanbul_turkiye,yeni_yeni_olmayan_konut,fiyat_endeksi");

        assertThat(result.rowsRead()).isZero();
        verify(housingPriceRepository, never()).upsertAll(anyList(), anyInt());
    }

    @Test
    void importCsv_badRow_writesNothing() {
        String csv = CSV + "2010-03-01,İstanbul,Yeni Konut,abc\n";

        assertThatThrownBy(() -> importService.importCsv(csv))
                .isInstanceOf(HousingImportException.class)
                .hasMessageContaining("could not convert string to float: 'abc'");

        verify(housingPriceRepository, never()).upsertAll(anyList(), anyInt());
        verify(transactionManager, never()).getTransaction(any());
    }

    @Test
    void importCsv_databaseFailure_rollsBack() {
        when(housingPriceRepository.upsertAll(anyList(), anyInt()))
                .thenThrow(new DataIntegrityViolationException("value too long"));

        assertThatThrownBy(() -> importService.importCsv(CSV))
                .isInstanceOf(DataIntegrityViolationException.class);

        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void importFile_readsUtf8File(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("housing.csv");
        Files.writeString(file, CSV, StandardCharsets.UTF_8);
        when(housingPriceRepository.upsertAll(anyList(), anyInt())).thenReturn(2);

        ImportResult result = importService.importFile(file);

        assertThat(result).isEqualTo(new ImportResult(2, 2));
    }

    @Test
    void importFile_missingFile_fails(@TempDir Path dir) {
        assertThatThrownBy(() -> importService.importFile(dir.resolve("missing.csv")))
                .isInstanceOf(HousingImportException.class)
                .hasMessageContaining("could not read");
    }
}
