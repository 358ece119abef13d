package com.seqmine.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Mapping from sanitized action symbols to stable integer codes.
 * Codes are 1..k assigned in lexicographic symbol order, independent of input order.
 */
public final class SymbolDictionary {

    private final Map<String, Integer> codes;
    private final List<String> symbols;

    private SymbolDictionary(List<String> orderedSymbols) {
        Map<String, Integer> byCode = new LinkedHashMap<>();
        for (int i = 0; i < orderedSymbols.size(); i++) {
            byCode.put(orderedSymbols.get(i), i + 1);
        }
        this.codes = Collections.unmodifiableMap(byCode);
        this.symbols = List.copyOf(orderedSymbols);
    }

    /**
     * Build a dictionary over the distinct values of the given symbols.
     */
    public static SymbolDictionary of(Collection<String> symbols) {
        return new SymbolDictionary(new ArrayList<>(new TreeSet<>(symbols)));
    }

    public int size() {
        return symbols.size();
    }

    public boolean contains(String symbol) {
        return codes.containsKey(symbol);
    }

    /**
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public int codeOf(String symbol) {
        Integer code = codes.get(symbol);
        if (code == null) {
            throw new IllegalArgumentException("Unknown symbol: " + symbol);
        }
        return code;
    }

    /**
     * @throws IllegalArgumentException if the code is out of range
     */
    public String symbolOf(int code) {
        if (code < 1 || code > symbols.size()) {
            throw new IllegalArgumentException("Unknown symbol code: " + code);
        }
        return symbols.get(code - 1);
    }

    /**
     * Symbols in code order.
     */
    public List<String> symbols() {
        return symbols;
    }

    public Map<String, Integer> asMap() {
        return codes;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SymbolDictionary other && symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return "SymbolDictionary" + codes;
    }
}
