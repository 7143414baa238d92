package org.sans.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/** Utilities that operate on collections in a functional style. */
public class Linq {
    private Linq() {}

    public static <T, S> List<S> map(Collection<T> data, Function<T, S> function) {
        List<S> result = new ArrayList<>(data.size());
        for (T aData : data)
            result.add(function.apply(aData));
        return result;
    }

    public static <T> List<T> where(Collection<T> data, Predicate<T> function) {
        List<T> result = new ArrayList<>();
        for (T aData : data)
            if (function.test(aData))
                result.add(aData);
        return result;
    }

    public static <T> boolean any(Iterable<T> data, Predicate<T> test) {
        for (T d : data)
            if (test.test(d))
                return true;
        return false;
    }

    public static <T> boolean all(Iterable<T> data, Predicate<T> test) {
        for (T d : data)
            if (!test.test(d))
                return false;
        return true;
    }

    public static <T> List<T> concat(List<T> left, List<T> right) {
        List<T> result = new ArrayList<>(left);
        result.addAll(right);
        return result;
    }
}
