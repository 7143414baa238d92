package org.sans.compiler.frontend;

import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.type.Schema;

import java.util.Map;

/** Converts the text of one compilation unit into a plan.
 * Problems local to a part of the text are represented as refused blocks
 * in the plan, not thrown. */
public interface IFrontend {
    Plan compile(String source, Map<String, Schema> predeclared);
}
