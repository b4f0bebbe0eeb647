package com.xinyue.hft.common;

import org.agrona.collections.Object2IntHashMap;

/**
 * Symbol 字符串到 symbolId 的映射注册表。
 * 使用 Agrona 的 Object2IntHashMap 实现零GC映射。
 * <p>
 * 每个进程入口自己持有一个实例，不做全局单例。
 */
public final class SymbolRegistry {

    private static final int MISSING = -1;

    private final Object2IntHashMap<String> symbolToIdMap = new Object2IntHashMap<>(MISSING);
    private final String[] idToSymbolMap = new String[Short.MAX_VALUE];
    private short nextId = 1;

    /**
     * 注册或获取 symbol 对应的 symbolId。
     * 如果 symbol 不存在，自动分配新的 ID。
     */
    public short register(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol 不能为空");
        }
        int id = symbolToIdMap.getValue(symbol);
        if (id != MISSING) {
            return (short) id;
        }
        if (nextId == Short.MAX_VALUE) {
            throw new IllegalStateException("symbolId 已用尽");
        }
        short assigned = nextId++;
        symbolToIdMap.put(symbol, assigned);
        idToSymbolMap[assigned] = symbol;
        return assigned;
    }

    /**
     * 查询已注册的 symbolId，不存在返回 -1。
     */
    public short get(String symbol) {
        return (short) symbolToIdMap.getValue(symbol);
    }

    public String getSymbol(short symbolId) {
        if (symbolId <= 0 || symbolId >= idToSymbolMap.length) {
            return null;
        }
        return idToSymbolMap[symbolId];
    }

    public int size() {
        return symbolToIdMap.size();
    }
}
