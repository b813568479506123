package io.github.yok.marlea.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class CountTest {

    @Test
    void parse_正常ケース_数字のみのリテラルを指定する_値が返ること() {
        assertEquals(42L, Count.parse("42").getValue());
        assertEquals(7L, Count.parse("007").getValue());
    }

    @Test
    void parse_正常ケース_0と1を指定する_定数が返ること() {
        assertSame(Count.ZERO, Count.parse("0"));
        assertSame(Count.ONE, Count.parse("1"));
    }

    @Test
    void parse_異常ケース_負数を指定する_NumberFormatExceptionが送出されること() {
        assertThrows(NumberFormatException.class, () -> Count.parse("-1"));
    }

    @Test
    void parse_異常ケース_数字以外を含む_NumberFormatExceptionが送出されること() {
        assertThrows(NumberFormatException.class, () -> Count.parse("12a"));
        assertThrows(NumberFormatException.class, () -> Count.parse("1.5"));
        assertThrows(NumberFormatException.class, () -> Count.parse(" 1"));
    }

    @Test
    void parse_異常ケース_空文字とnullを指定する_NumberFormatExceptionが送出されること() {
        assertThrows(NumberFormatException.class, () -> Count.parse(""));
        assertThrows(NumberFormatException.class, () -> Count.parse(null));
    }

    @Test
    void parse_異常ケース_longの範囲を超える_NumberFormatExceptionが送出されること() {
        assertThrows(NumberFormatException.class, () -> Count.parse("9223372036854775808"));
    }

    @Test
    void of_異常ケース_負数を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> Count.of(-1L));
    }

    @Test
    void plus_正常ケース_2つの値を加算する_合計が返ること() {
        assertEquals(Count.of(5L), Count.of(2L).plus(Count.of(3L)));
    }

    @Test
    void plus_異常ケース_オーバーフローする_ArithmeticExceptionが送出されること() {
        Count max = Count.of(Long.MAX_VALUE);
        assertThrows(ArithmeticException.class, () -> max.plus(Count.ONE));
    }

    @Test
    void compareTo_正常ケース_大小比較する_数値順になること() {
        assertTrue(Count.of(2L).compareTo(Count.of(10L)) < 0);
        assertEquals(0, Count.of(10L).compareTo(Count.parse("10")));
    }

    @Test
    void toString_正常ケース_文字列化する_10進表記が返ること() {
        assertEquals("10", Count.of(10L).toString());
    }
}
