package org.sans.compiler.frontend.legacy;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.frontend.Block;
import org.sans.compiler.frontend.Statement;
import org.sans.compiler.ir.step.AggregateStep;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.RefusedBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * proc summary data=in [nway]; class keys; var columns; output out=out mean= sum= / autoname; run;
 * Only the fully crossed (nway) result is produced; without NWAY a warning is emitted.
 */
public class ProcSummaryRecognizer extends BlockRecognizer {
    public ProcSummaryRecognizer(Block block, CompilerOptions options) {
        super(block, options);
    }

    Statement single(String keyword, boolean required) {
        List<Statement> found = this.statements(keyword);
        if (found.size() > 1 || (required && found.isEmpty()))
            throw this.error(ErrorCode.SUMMARY_MALFORMED,
                    "PROC SUMMARY requires " + (required ? "exactly" : "at most") + " one "
                            + keyword.toUpperCase() + " statement");
        return found.isEmpty() ? null : found.get(0);
    }

    @Override
    public List<IRStep> recognize() {
        Map<String, String> header = headerOptions(this.block.header, 2);
        boolean nway = false;
        for (Map.Entry<String, String> option: header.entrySet()) {
            switch (option.getKey()) {
                case "data":
                    break;
                case "nway":
                    nway = true;
                    break;
                case "noprint":
                    break;
                default:
                    throw this.error(ErrorCode.SUMMARY_MALFORMED,
                            "Unsupported PROC SUMMARY option '" + option.getKey() + "'", this.block.header);
            }
        }
        String data = header.get("data");
        if (data == null || data.isEmpty())
            throw this.error(ErrorCode.SUMMARY_MALFORMED, "PROC SUMMARY requires DATA=", this.block.header);
        this.onlyStatements(ErrorCode.SUMMARY_MALFORMED, "PROC SUMMARY", "class", "var", "output");

        Statement classStatement = this.single("class", false);
        Statement var = this.single("var", true);
        Statement output = this.single("output", true);
        List<String> groupBy = classStatement == null ? List.of() : words(classStatement);
        List<String> columns = words(var);
        if (columns.isEmpty())
            throw this.error(ErrorCode.SUMMARY_MALFORMED, "Empty VAR statement", var);

        String outputText = afterKeyword(output);
        int slash = outputText.indexOf('/');
        if (slash < 0 || !outputText.substring(slash + 1).strip().equalsIgnoreCase("autoname"))
            throw this.error(ErrorCode.SUMMARY_MALFORMED,
                    "OUTPUT statement must end with '/ autoname'", output);
        String[] parts = outputText.substring(0, slash).replaceAll("\\s*=", "=").strip().split("\\s+");
        String out = null;
        List<AggregateStep.Statistic> statistics = new ArrayList<>();
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            int eq = part.indexOf('=');
            if (eq <= 0)
                throw this.error(ErrorCode.SUMMARY_MALFORMED, "Unexpected '" + part + "' in OUTPUT statement", output);
            String key = part.substring(0, eq).toLowerCase();
            String value = part.substring(eq + 1);
            if (key.equals("out")) {
                if (value.isEmpty() && i + 1 < parts.length && !parts[i + 1].contains("=")) {
                    i++;
                    value = parts[i];
                }
                if (value.isEmpty() || out != null)
                    throw this.error(ErrorCode.SUMMARY_MALFORMED, "Malformed OUT= in OUTPUT statement", output);
                out = value;
                continue;
            }
            AggregateStep.Statistic statistic = AggregateStep.Statistic.fromText(key);
            if (statistic == null || statistic == AggregateStep.Statistic.COUNT)
                throw this.error(ErrorCode.SUMMARY_MALFORMED, "Unsupported statistic '" + key + "'", output);
            if (!value.isEmpty())
                throw this.error(ErrorCode.SUMMARY_MALFORMED,
                        "Explicit output names are not supported; use " + key + "= with autoname", output);
            if (statistics.contains(statistic))
                throw this.error(ErrorCode.SUMMARY_MALFORMED, "Duplicate statistic '" + key + "'", output);
            statistics.add(statistic);
        }
        if (out == null)
            throw this.error(ErrorCode.SUMMARY_MALFORMED, "OUTPUT statement requires OUT=", output);
        if (statistics.isEmpty())
            throw this.error(ErrorCode.SUMMARY_MALFORMED, "OUTPUT statement requires at least one statistic", output);

        List<IRStep> result = new ArrayList<>();
        if (!nway)
            result.add(new RefusedBlock(ErrorCode.SUMMARY_MALFORMED,
                    "PROC SUMMARY without NWAY: only the fully crossed result is produced",
                    this.block.header.range, RefusedBlock.Severity.WARNING));
        result.add(new AggregateStep(this.block.range, this.tableName(data, this.block.header),
                this.tableName(out, output), groupBy, AggregateStep.columnMajor(columns, statistics)));
        return result;
    }
}
