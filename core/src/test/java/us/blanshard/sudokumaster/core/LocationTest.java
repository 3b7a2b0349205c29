/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.sudokumaster.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import org.junit.Test;

public class LocationTest {

  @Test public void coordinates() {
    Location loc = Location.of(4, 7);
    assertEquals(4, loc.row);
    assertEquals(7, loc.column);
    assertEquals(5, loc.box);
    assertEquals(43, loc.index);
    assertSame(loc, Location.of(43));
    assertEquals("(4, 7)", loc.toString());
  }

  @Test public void all() {
    assertEquals(Location.COUNT, Location.ALL.size());
    for (int i = 0; i < Location.COUNT; ++i)
      assertEquals(i, Location.ALL.get(i).index);
  }

  @Test public void units() {
    assertEquals(27, Location.UNITS.size());
    for (ImmutableList<Location> unit : Location.UNITS)
      assertEquals(9, Sets.newHashSet(unit).size());
    assertEquals(Location.of(3, 6), Location.UNITS.get(18 + 5).get(0));
    assertEquals(Location.of(5, 8), Location.UNITS.get(18 + 5).get(8));
  }

  @Test public void boxCorners() {
    assertEquals(0, Location.boxTop(2));
    assertEquals(6, Location.boxLeft(2));
    assertEquals(6, Location.boxTop(7));
    assertEquals(3, Location.boxLeft(7));
  }

  @Test(expected = IndexOutOfBoundsException.class) public void badRow() {
    Location.of(9, 0);
  }

  @Test(expected = IndexOutOfBoundsException.class) public void badIndex() {
    Location.of(-1);
  }
}
