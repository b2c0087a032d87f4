package org.localcompute.algebra.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.io.PrintWriter;

/**
 * Prints command results as pretty-printed JSON. Expression trees are written as their formatted text.
 */
public final class JsonOutput {

    private static final ExpressionFormatter FORMATTER = new ExpressionFormatter();

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .registerTypeHierarchyAdapter(Expr.class,
                    (JsonSerializer<Expr>) (expr, type, context) -> new JsonPrimitive(FORMATTER.format(expr)))
            .create();

    private JsonOutput() {
    }

    public static String toJson(Object value) {
        return GSON.toJson(value);
    }

    public static void print(PrintWriter out, Object value) {
        out.println(toJson(value));
        out.flush();
    }
}
