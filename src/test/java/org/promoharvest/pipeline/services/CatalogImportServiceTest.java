package org.promoharvest.pipeline.services;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.promoharvest.junit.extensions.logging.ExpectLog;
import org.promoharvest.junit.extensions.logging.LogLevel;
import org.promoharvest.junit.extensions.logging.LogWatchExtension;
import org.promoharvest.pipeline.api.catalog.ICatalogImporter;
import org.promoharvest.pipeline.api.catalog.ImportResult;
import org.promoharvest.pipeline.api.records.HarvestRecord;
import org.promoharvest.pipeline.api.resources.IResource;
import org.promoharvest.pipeline.api.services.IService;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class CatalogImportServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private ICatalogImporter importer;

    private Path recordLog;

    @BeforeEach
    void setUp() throws Exception {
        recordLog = tempDir.resolve("records.jsonl");
        Files.write(recordLog, List.of(
            "{\"product_id\":\"a\",\"name\":\"Mug\"}",
            "{\"product_id\":\"b\",\"name\":\"Pen\"}",
            "{\"name\":\"no identity\"}",
            "{\"product_id\":\"c\",\"name\":\"Cap\"}"));
    }

    @Test
    void run_submitsIdentifiedRecordsInChunks() throws Exception {
        // Given
        when(importer.importRecords(anyList())).thenAnswer(inv -> accept(inv.getArgument(0)));

        // When
        CatalogImportService service = runToEnd(Map.of("batchSize", 2));

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<HarvestRecord>> chunks = ArgumentCaptor.forClass(List.class);
        verify(importer, times(2)).importRecords(chunks.capture());
        assertThat(chunks.getAllValues()).extracting(List::size).containsExactly(2, 1);
        assertThat(service.getAccepted()).isEqualTo(3);
        assertThat(service.getSkipped()).isEqualTo(1);
        assertThat(service.getRejected()).isZero();
        assertThat(service.getMetrics()).containsEntry("chunks_submitted", 2L);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Catalog rejected record 'b': HTTP 422: missing price")
    void run_logsRejectionsAndContinues() throws Exception {
        when(importer.importRecords(anyList())).thenReturn(List.of(
            ImportResult.accepted("a", "HTTP 201"),
            ImportResult.rejected("b", "HTTP 422: missing price"),
            ImportResult.accepted("c", "HTTP 201")));

        CatalogImportService service = runToEnd(Map.of());

        assertThat(service.getAccepted()).isEqualTo(2);
        assertThat(service.getRejected()).isEqualTo(1);
        assertThat(service.getErrors()).singleElement()
            .satisfies(e -> assertThat(e.errorType()).isEqualTo("IMPORT_REJECTED"));
        assertThat(service.getCurrentState()).isEqualTo(IService.State.STOPPED);
    }

    @Test
    void dryRun_neverCallsImporter() throws Exception {
        CatalogImportService service = runToEnd(Map.of("dryRun", true));

        verify(importer, never()).importRecords(anyList());
        assertThat(service.getAccepted()).isEqualTo(3);
    }

    @Test
    void constructor_requiresRecordLog() {
        assertThatThrownBy(() -> new CatalogImportService("catalogImport", ConfigFactory.empty(),
            Map.of("importer", List.<IResource>of(importer))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("recordLog");
    }

    private CatalogImportService runToEnd(Map<String, Object> overrides) throws Exception {
        Map<String, Object> options = new HashMap<>(overrides);
        options.put("recordLog", recordLog.toString());
        CatalogImportService service = new CatalogImportService("catalogImport", ConfigFactory.parseMap(options),
            Map.of("importer", List.<IResource>of(importer)));
        service.start();
        assertThat(service.awaitTermination(5_000)).isTrue();
        return service;
    }

    private static List<ImportResult> accept(List<HarvestRecord> records) {
        return records.stream()
            .map(r -> ImportResult.accepted(String.valueOf(r.get("product_id")), "HTTP 201"))
            .collect(Collectors.toList());
    }
}
