package com.xinyue.hft.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("品种注册表")
class SymbolRegistryTest {

    @Test
    @DisplayName("从 1 开始分配，重复注册返回同一个 ID")
    void testRegister() {
        SymbolRegistry registry = new SymbolRegistry();
        assertEquals(1, registry.register("AAA"));
        assertEquals(2, registry.register("BBB"));
        assertEquals(1, registry.register("AAA"));
        assertEquals(2, registry.size());
        assertEquals("BBB", registry.getSymbol((short) 2));
        assertEquals(-1, registry.get("CCC"));
        assertNull(registry.getSymbol((short) 9));
    }

    @Test
    @DisplayName("空 symbol 非法")
    void testBlankSymbol() {
        assertThrows(IllegalArgumentException.class, () -> new SymbolRegistry().register(" "));
    }
}
