package org.sans.compiler.frontend.legacy;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.frontend.Block;
import org.sans.compiler.frontend.Statement;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.SortStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** proc sort data=in out=out [nodupkey]; by [descending] key ...; */
public class ProcSortRecognizer extends BlockRecognizer {
    public ProcSortRecognizer(Block block, CompilerOptions options) {
        super(block, options);
    }

    @Override
    public List<IRStep> recognize() {
        Map<String, String> header = headerOptions(this.block.header, 2);
        boolean nodupkey = false;
        for (Map.Entry<String, String> option: header.entrySet()) {
            switch (option.getKey()) {
                case "data":
                case "out":
                    if (option.getValue().isEmpty())
                        throw this.error(ErrorCode.SORT_UNSUPPORTED_OPTION,
                                "PROC SORT option " + option.getKey().toUpperCase() + "= requires a table",
                                this.block.header);
                    break;
                case "nodupkey":
                    nodupkey = true;
                    break;
                default:
                    throw this.error(ErrorCode.SORT_UNSUPPORTED_OPTION,
                            "Unsupported PROC SORT option '" + option.getKey() + "'", this.block.header);
            }
        }
        if (!header.containsKey("data") || !header.containsKey("out"))
            throw this.error(ErrorCode.SORT_UNSUPPORTED_OPTION,
                    "PROC SORT requires both DATA= and OUT=", this.block.header);

        for (Statement statement: this.block.body) {
            if (statement.keyword().equals("by"))
                continue;
            if (statement.lower().equals("nodupkey")) {
                nodupkey = true;
                continue;
            }
            throw this.error(ErrorCode.SORT_UNSUPPORTED_OPTION,
                    "PROC SORT does not support the statement '" + statement.text + "'", statement);
        }
        List<Statement> byStatements = this.statements("by");
        if (byStatements.size() != 1)
            throw this.error(ErrorCode.SORT_MISSING_BY, "PROC SORT requires exactly one BY statement");
        Statement by = byStatements.get(0);

        List<SortStep.SortKey> keys = new ArrayList<>();
        boolean descending = false;
        for (String word: words(by)) {
            if (word.equalsIgnoreCase("descending")) {
                if (descending)
                    throw this.error(ErrorCode.SORT_MISSING_BY, "Repeated DESCENDING in BY statement", by);
                descending = true;
                continue;
            }
            keys.add(new SortStep.SortKey(word, descending));
            descending = false;
        }
        if (descending || keys.isEmpty())
            throw this.error(ErrorCode.SORT_MISSING_BY, "Malformed BY statement: '" + by.text + "'", by);

        String input = this.tableName(header.get("data"), this.block.header);
        String output = this.tableName(header.get("out"), this.block.header);
        return List.of(new SortStep(this.block.range, input, output, keys, nodupkey));
    }
}
