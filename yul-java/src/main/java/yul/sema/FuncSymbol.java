package yul.sema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record FuncSymbol(String name, List<String> parameterTypes, List<String> returnTypes) implements Symbol {

    public FuncSymbol {
        // types may be null (untyped)
        parameterTypes = Collections.unmodifiableList(new ArrayList<>(parameterTypes));
        returnTypes = Collections.unmodifiableList(new ArrayList<>(returnTypes));
    }
}
