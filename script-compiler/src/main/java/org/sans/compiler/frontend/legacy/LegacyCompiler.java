package org.sans.compiler.frontend.legacy;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.frontend.Block;
import org.sans.compiler.frontend.BlockSegmenter;
import org.sans.compiler.frontend.IFrontend;
import org.sans.compiler.frontend.MacroPreprocessor;
import org.sans.compiler.frontend.Statement;
import org.sans.compiler.frontend.StatementSplitter;
import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.RefusedBlock;
import org.sans.compiler.ir.type.Schema;
import org.sans.util.IWritesLogs;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Compiles the legacy dialect: macro expansion, statement splitting,
 * block segmentation and recognition of each block.  A block which cannot be
 * recognized becomes a refused block; the other blocks are still compiled. */
public class LegacyCompiler implements IFrontend, IWritesLogs {
    private final CompilerOptions options;
    /** File the source was read from; relative %include paths are resolved against it. */
    @Nullable
    private final Path sourceFile;

    public LegacyCompiler(CompilerOptions options, @Nullable Path sourceFile) {
        this.options = options;
        this.sourceFile = sourceFile;
    }

    public LegacyCompiler(CompilerOptions options) {
        this(options, null);
    }

    @Override
    public Plan compile(String source, Map<String, Schema> predeclared) {
        String expanded;
        try {
            MacroPreprocessor preprocessor = new MacroPreprocessor(this.options.ioOptions.includeRoots);
            expanded = preprocessor.process(source, this.sourceFile);
        } catch (CompilationError error) {
            return new Plan(Map.of(), predeclared,
                    List.of(RefusedBlock.from(error, SourcePositionRange.lines(1, 1))));
        }

        List<Statement> statements = StatementSplitter.split(expanded);
        List<Block> blocks = BlockSegmenter.segment(statements);
        List<IRStep> steps = new ArrayList<>();
        for (Block block: blocks) {
            if (block.kind == Block.Kind.OTHER && isStrayTerminator(block.header))
                continue;
            try {
                steps.addAll(this.recognizer(block).recognize());
            } catch (CompilationError error) {
                if (this.options.languageOptions.throwOnError)
                    throw error;
                // The refusal covers the whole block; the message names the statement
                RefusedBlock refused = new RefusedBlock(error.code, error.getMessage(), block.range);
                this.getDebugStream(1)
                        .append("Refused ")
                        .append(block.toString())
                        .append(": ")
                        .append(refused.toString())
                        .newline();
                steps.add(refused);
            }
        }
        this.getDebugStream(1)
                .append("Compiled ")
                .append(blocks.size())
                .append(" blocks into ")
                .append(steps.size())
                .append(" steps")
                .newline();
        return new Plan(Map.of(), predeclared, steps);
    }

    static boolean isStrayTerminator(Statement statement) {
        String lower = statement.lower();
        return lower.equals("run") || lower.equals("quit");
    }

    BlockRecognizer recognizer(Block block) {
        switch (block.kind) {
            case DATA:
                return new DataStepRecognizer(block, this.options);
            case PROC: {
                String[] words = block.header.lower().split("\\s+");
                String proc = words.length > 1 ? words[1] : "";
                switch (proc) {
                    case "sort":
                        return new ProcSortRecognizer(block, this.options);
                    case "transpose":
                        return new ProcTransposeRecognizer(block, this.options);
                    case "sql":
                        return new ProcSqlRecognizer(block, this.options);
                    case "format":
                        return new ProcFormatRecognizer(block, this.options);
                    case "summary":
                        return new ProcSummaryRecognizer(block, this.options);
                    default:
                        throw new CompilationError(ErrorCode.UNSUPPORTED_PROC,
                                "Unsupported procedure '" + proc + "'", block.header.range);
                }
            }
            default:
                throw new CompilationError(ErrorCode.UNSUPPORTED_STATEMENT,
                        "Unsupported statement '" + block.header.text + "'", block.header.range);
        }
    }
}
