package querycompiler.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import querycompiler.compile.CompiledQuery;
import querycompiler.compile.QueryTerm;
import querycompiler.pipeline.BatchResult;
import querycompiler.pipeline.SlotFailure;
import querycompiler.pipeline.SlotQuery;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  String build(BatchResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(result));
    root.put("queries", queries(result.queries()));
    if (!result.failures().isEmpty()) {
      root.put("failures", failures(result.failures()));
    }
    return gson.toJson(root);
  }

  private Map<String, Object> meta(BatchResult result) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", result.elapsedMillis());
    meta.put("timings", new LinkedHashMap<>(result.phaseMillis()));
    meta.put("node_count", result.graph().nodes().size());
    meta.put("edge_count", result.graph().edges().size());
    meta.put("slot_count", result.queries().size());
    meta.put("failure_count", result.failures().size());
    meta.put("expanded_count", result.expandedCount());
    meta.put("capped_count", result.cappedCount());
    meta.put("degraded_count", result.degradedCount());
    return meta;
  }

  private List<Map<String, Object>> queries(List<SlotQuery> queries) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (SlotQuery query : queries) {
      CompiledQuery compiled = query.compiled();
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("edge", query.edgeId());
      map.put("edge_key", query.edgeKey());
      map.put("slot", query.slot().label());
      map.put("slot_kind", query.slot().kind().label());
      map.put("parameter_id", query.parameterId());
      if (!query.condition().isEmpty()) {
        map.put("condition", query.condition());
      }
      map.put("query", compiled.query());
      map.put("native_exclude", compiled.capability().nativeExclude());
      map.put("degraded", compiled.capability().degraded());
      map.put("checks", compiled.checks());
      map.put("capped", compiled.capped());
      map.put("satisfiable", compiled.satisfiable());
      if (compiled.expanded()) {
        map.put("terms", terms(compiled.terms()));
      }
      if (!compiled.warnings().isEmpty()) {
        map.put("warnings", compiled.warnings());
      }
      list.add(map);
    }
    return list;
  }

  private List<Map<String, Object>> terms(List<QueryTerm> terms) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (QueryTerm term : terms) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("coefficient", term.coefficient());
      map.put("visited", new ArrayList<>(term.visited()));
      map.put("query", term.query());
      list.add(map);
    }
    return list;
  }

  private List<Map<String, Object>> failures(List<SlotFailure> failures) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (SlotFailure failure : failures) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("edge", failure.edgeId());
      map.put("slot", failure.slot().label());
      map.put("error", failure.errorType());
      map.put("message", failure.message());
      list.add(map);
    }
    return list;
  }
}
