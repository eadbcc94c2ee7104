package com.statuta.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.pipeline.CompilationResult;
import com.statuta.compiler.pipeline.Diagnostic;
import com.statuta.verify.VerificationResult;
import com.statuta.verify.model.Counterexample;

import java.util.List;

/**
 * 诊断与验证结果的文本和 JSON 呈现
 */
final class DiagnosticRenderer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private DiagnosticRenderer() {}

    // ============ 文本 ============

    static String text(CompilationResult result) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : result.getDiagnostics()) {
            sb.append(text(d)).append('\n');
        }
        int count = result.getDiagnostics().size();
        if (count == 0) {
            sb.append(result.getFileName()).append(": no problems found\n");
        } else {
            sb.append(result.getFileName()).append(": ").append(count)
                    .append(count == 1 ? " problem" : " problems").append('\n');
        }
        return sb.toString();
    }

    /** 两个文件之间的冲突 */
    static String text(String first, String second, List<Diagnostic> conflicts) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : conflicts) {
            sb.append(text(d)).append('\n');
        }
        sb.append(first).append(" and ").append(second).append(": ");
        int count = conflicts.size();
        if (count == 0) {
            sb.append("no conflicts found\n");
        } else {
            sb.append(count).append(count == 1 ? " conflict" : " conflicts").append('\n');
        }
        return sb.toString();
    }

    static String text(Diagnostic d) {
        SourceLocation loc = d.getLocation();
        StringBuilder sb = new StringBuilder();
        if (loc != SourceLocation.UNKNOWN) {
            sb.append(loc.getFile()).append(':').append(loc.getLine()).append(':').append(loc.getColumn()).append(": ");
        }
        sb.append(d.isFatal() ? "error" : "problem")
                .append(" [").append(d.getPhase().name().toLowerCase()).append(' ').append(d.getKind()).append("] ")
                .append(d.getMessage());
        return sb.toString();
    }

    // ============ JSON ============

    static JsonObject toJson(Diagnostic d) {
        JsonObject obj = new JsonObject();
        obj.addProperty("phase", d.getPhase().name());
        obj.addProperty("kind", d.getKind());
        obj.addProperty("fatal", d.isFatal());
        SourceLocation loc = d.getLocation();
        if (loc != SourceLocation.UNKNOWN) {
            obj.addProperty("file", loc.getFile());
            obj.addProperty("line", loc.getLine());
            obj.addProperty("column", loc.getColumn());
        }
        obj.addProperty("message", d.getMessage());
        return obj;
    }

    static JsonObject toJson(CompilationResult result) {
        JsonObject obj = new JsonObject();
        obj.addProperty("file", result.getFileName());
        obj.addProperty("success", result.isSuccess());
        obj.addProperty("fatal", result.isFatal());
        JsonArray diagnostics = new JsonArray();
        for (Diagnostic d : result.getDiagnostics()) {
            diagnostics.add(toJson(d));
        }
        obj.add("diagnostics", diagnostics);
        return obj;
    }

    static JsonObject toJson(VerificationResult result) {
        JsonObject obj = new JsonObject();
        obj.addProperty("principle", result.getPrincipleName());
        obj.addProperty("verdict", result.getVerdict().name());
        if (result.getMessage() != null) {
            obj.addProperty("message", result.getMessage());
        }
        Counterexample model = result.getCounterexample() != null ? result.getCounterexample() : result.getWitness();
        if (model != null) {
            JsonObject assignments = new JsonObject();
            for (Counterexample.Assignment a : model.getAssignments()) {
                assignments.addProperty(a.getName(), a.getValue());
            }
            obj.add(result.getWitness() != null ? "witness" : "counterexample", assignments);
        }
        return obj;
    }

    static JsonArray toJson(List<VerificationResult> results) {
        JsonArray array = new JsonArray();
        for (VerificationResult r : results) {
            array.add(toJson(r));
        }
        return array;
    }

    static JsonObject toJson(String first, String second, List<Diagnostic> conflicts) {
        JsonObject obj = new JsonObject();
        obj.addProperty("first", first);
        obj.addProperty("second", second);
        obj.addProperty("conflictCount", conflicts.size());
        JsonArray array = new JsonArray();
        for (Diagnostic d : conflicts) {
            array.add(toJson(d));
        }
        obj.add("conflicts", array);
        return obj;
    }

    static String json(String first, String second, List<Diagnostic> conflicts) {
        return GSON.toJson(toJson(first, second, conflicts));
    }

    static String json(CompilationResult result) {
        return GSON.toJson(toJson(result));
    }

    static String json(List<VerificationResult> results) {
        return GSON.toJson(toJson(results));
    }
}
