package com.cliffc.realc.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestAry {
  @Test public void testPushPop() {
    Ary<String> ary = new Ary<>(String.class);
    assertTrue(ary.isEmpty());
    ary.push("a").push("b").push("c");
    assertEquals(3,ary.len());
    assertEquals("c",ary.last());
    assertEquals("c",ary.pop());
    assertNull(ary._es[2]);
    assertEquals("{a,b}",ary.toString());
    assertArrayEquals(new String[]{"a","b"},ary.asAry());
    ary.clear();
    assertTrue(ary.isEmpty());
    assertThrows(ArrayIndexOutOfBoundsException.class, ary::pop);
    assertThrows(ArrayIndexOutOfBoundsException.class, () -> ary.at(0));
  }

  @Test public void testIterate() {
    Ary<Integer> ary = new Ary<>(Integer.class);
    for( int i=0; i<100; i++ ) ary.push(i);
    int sum=0;
    for( int i : ary ) sum += i;
    assertEquals(4950,sum);
  }
}
