package org.sans.compiler.frontend.legacy;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.frontend.Block;
import org.sans.compiler.frontend.Statement;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.TransposeStep;

import java.util.List;
import java.util.Map;

/** proc transpose data=in out=out; by keys; id column; var column; */
public class ProcTransposeRecognizer extends BlockRecognizer {
    public ProcTransposeRecognizer(Block block, CompilerOptions options) {
        super(block, options);
    }

    List<String> single(String keyword, boolean oneColumn) {
        List<Statement> found = this.statements(keyword);
        if (found.size() != 1)
            throw this.error(ErrorCode.TRANSPOSE_MALFORMED,
                    "PROC TRANSPOSE requires exactly one " + keyword.toUpperCase() + " statement");
        List<String> result = words(found.get(0));
        if (result.isEmpty() || (oneColumn && result.size() != 1))
            throw this.error(ErrorCode.TRANSPOSE_MALFORMED,
                    "Malformed " + keyword.toUpperCase() + " statement: '" + found.get(0).text + "'", found.get(0));
        return result;
    }

    @Override
    public List<IRStep> recognize() {
        Map<String, String> header = headerOptions(this.block.header, 2);
        for (String key: header.keySet())
            if (!key.equals("data") && !key.equals("out"))
                throw this.error(ErrorCode.TRANSPOSE_MALFORMED,
                        "Unsupported PROC TRANSPOSE option '" + key + "'", this.block.header);
        String data = header.get("data");
        String out = header.get("out");
        if (data == null || data.isEmpty() || out == null || out.isEmpty())
            throw this.error(ErrorCode.TRANSPOSE_MALFORMED,
                    "PROC TRANSPOSE requires both DATA= and OUT=", this.block.header);
        this.onlyStatements(ErrorCode.TRANSPOSE_MALFORMED, "PROC TRANSPOSE", "by", "id", "var");

        List<String> by = this.single("by", false);
        String id = this.single("id", true).get(0);
        String var = this.single("var", true).get(0);
        return List.of(new TransposeStep(this.block.range,
                this.tableName(data, this.block.header), this.tableName(out, this.block.header), by, id, var));
    }
}
