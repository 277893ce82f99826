package com.modelspec.expr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modelspec.data.DataFrame;
import com.modelspec.data.Factor;
import com.modelspec.exception.ModelSpecException;

import lombok.experimental.UtilityClass;

/**
 * Functions available to every expression through {@link Environment#builtins()}.
 */
@UtilityClass
class BuiltinFunctions {

    static Map<String, ExprFunction> all() {
        Map<String, ExprFunction> fns = new LinkedHashMap<>();
        fns.put("c", (args, named) -> flatten(args));
        fns.put("list", BuiltinFunctions::list);
        fns.put("as_matrix", (args, named) -> asMatrix(single("as_matrix", args)));
        fns.put("nrow", (args, named) -> nrow(single("nrow", args)));
        fns.put("ncol", (args, named) -> ncol(single("ncol", args)));
        fns.put("length", (args, named) -> length(single("length", args)));
        fns.put("levels", (args, named) -> levels(single("levels", args)));
        fns.put("min", (args, named) -> flatten(args).stream().mapToDouble(BuiltinFunctions::toDouble).min()
                .orElseThrow(() -> new ModelSpecException("min() needs at least one value")));
        fns.put("max", (args, named) -> flatten(args).stream().mapToDouble(BuiltinFunctions::toDouble).max()
                .orElseThrow(() -> new ModelSpecException("max() needs at least one value")));
        return Map.copyOf(fns);
    }

    private static Object single(String fn, List<Object> args) {
        if (args.size() != 1) {
            throw new ModelSpecException(fn + "() takes exactly one argument, got " + args.size());
        }
        return args.get(0);
    }

    private static List<Object> flatten(List<Object> args) {
        List<Object> out = new ArrayList<>();
        for (Object a : args) {
            if (a instanceof Collection<?> c) {
                out.addAll(c);
            } else {
                out.add(a);
            }
        }
        return out;
    }

    private static Object list(List<Object> args, Map<String, Object> named) {
        if (named.isEmpty()) {
            return new ArrayList<>(args);
        }
        if (!args.isEmpty()) {
            throw new ModelSpecException("list() arguments must be either all named or all positional");
        }
        return new LinkedHashMap<>(named);
    }

    private static double[][] asMatrix(Object x) {
        if (x instanceof double[][] m) {
            return m;
        }
        if (x instanceof DataFrame df) {
            return df.toMatrix();
        }
        throw new ModelSpecException("as_matrix() cannot convert a value of type " + typeName(x));
    }

    private static int nrow(Object x) {
        if (x instanceof DataFrame df) return df.nrow();
        if (x instanceof double[][] m) return m.length;
        if (x instanceof Collection<?> c) return c.size();
        throw new ModelSpecException("nrow() is not defined for " + typeName(x));
    }

    private static int ncol(Object x) {
        if (x instanceof DataFrame df) return df.ncol();
        if (x instanceof double[][] m) return m.length == 0 ? 0 : m[0].length;
        throw new ModelSpecException("ncol() is not defined for " + typeName(x));
    }

    private static int length(Object x) {
        if (x == null) return 0;
        if (x instanceof Collection<?> c) return c.size();
        if (x instanceof Map<?, ?> m) return m.size();
        if (x instanceof DataFrame df) return df.ncol();
        if (x instanceof double[][] m) return m.length;
        return 1;
    }

    private static List<String> levels(Object x) {
        if (x instanceof Factor f) {
            return f.getLevels();
        }
        throw new ModelSpecException("levels() needs a factor, got " + typeName(x));
    }

    static double toDouble(Object x) {
        if (x instanceof Number n) {
            return n.doubleValue();
        }
        throw new ModelSpecException("Expected a number but got " + typeName(x));
    }

    static String typeName(Object x) {
        return x == null ? "NULL" : x.getClass().getSimpleName();
    }
}
