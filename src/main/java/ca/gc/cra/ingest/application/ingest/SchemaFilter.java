package ca.gc.cra.ingest.application.ingest;

import ca.gc.cra.ingest.domain.ingest.DiagnosticKind;
import ca.gc.cra.ingest.domain.ingest.IngestDiagnostic;
import ca.gc.cra.ingest.domain.json.JsonObject;
import ca.gc.cra.ingest.domain.json.JsonValue;
import ca.gc.cra.ingest.domain.record.DataRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Drops candidate records that do not carry every required field.
 * <p><strong>Why:</strong> Partial schema compliance is expected from the API; bad rows are skipped and reported
 * rather than failing the page.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep conforming objects in their original order.</li>
 *   <li>Record one {@link DiagnosticKind#SCHEMA_VIOLATION} per dropped candidate with its batch index and the
 *   missing field names only.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class SchemaFilter {

  /**
   * Filters one batch.
   *
   * @param batch candidate records of one page
   * @param requiredFields field names every kept record must carry
   * @param page page number used in diagnostics
   * @param diagnostics run diagnostics
   * @return conforming records in batch order
   */
  public List<DataRecord> filter(
      List<JsonValue> batch, Set<String> requiredFields, int page, DiagnosticsCollector diagnostics) {
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(requiredFields, "requiredFields");
    Objects.requireNonNull(diagnostics, "diagnostics");
    List<DataRecord> kept = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      JsonValue candidate = batch.get(i);
      if (!(candidate instanceof JsonObject object)) {
        diagnostics.record(IngestDiagnostic.record(
            DiagnosticKind.SCHEMA_VIOLATION, page, i, "not an object (" + candidate.kind() + ")"));
        continue;
      }
      List<String> missing = new ArrayList<>();
      for (String field : requiredFields) {
        if (!object.has(field)) {
          missing.add(field);
        }
      }
      if (!missing.isEmpty()) {
        diagnostics.record(IngestDiagnostic.record(
            DiagnosticKind.SCHEMA_VIOLATION, page, i, "missing " + missing));
        continue;
      }
      kept.add(DataRecord.of(object));
    }
    return kept;
  }
}
