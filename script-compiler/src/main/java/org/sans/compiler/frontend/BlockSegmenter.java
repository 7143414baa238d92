package org.sans.compiler.frontend;

import java.util.ArrayList;
import java.util.List;

/** Groups statements into blocks.  A block opened by a DATA or PROC header
 * extends to the next run; or quit; statement, or to the next header. */
public class BlockSegmenter {
    private BlockSegmenter() {}

    static boolean isHeader(Statement statement) {
        String lower = statement.lower();
        return lower.startsWith("data ") || lower.startsWith("proc ");
    }

    static boolean isTerminator(Statement statement) {
        String lower = statement.lower();
        return lower.equals("run") || lower.equals("quit");
    }

    public static List<Block> segment(List<Statement> statements) {
        List<Block> blocks = new ArrayList<>();
        int i = 0;
        while (i < statements.size()) {
            Statement statement = statements.get(i);
            if (!isHeader(statement)) {
                blocks.add(new Block(Block.Kind.OTHER, statement, List.of(), null));
                i++;
                continue;
            }
            Block.Kind kind = statement.lower().startsWith("data ") ? Block.Kind.DATA : Block.Kind.PROC;
            List<Statement> body = new ArrayList<>();
            Statement end = null;
            i++;
            while (i < statements.size()) {
                Statement current = statements.get(i);
                if (isTerminator(current)) {
                    end = current;
                    i++;
                    break;
                }
                if (isHeader(current))
                    break;
                body.add(current);
                i++;
            }
            blocks.add(new Block(kind, statement, body, end));
        }
        return blocks;
    }
}
