/*
 * Copyright 2018 University of California, Riverside
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.ucr.cs.bdlab.colortiles.raptor;

import junit.framework.TestCase;

public class CellTypeTest extends TestCase {

  public void testNoDataIsStoredInCellPrecision() {
    assertEquals((double) (float) -99.9, CellType.FLOAT32.toCellValue(-99.9));
    assertEquals((double) (float) 1e20, CellType.FLOAT32.toCellValue(1e20));
    assertEquals(-99.9, CellType.FLOAT64.toCellValue(-99.9));
    assertEquals(-9999.0, CellType.FLOAT32.toCellValue(-9999));
    assertTrue(Double.isNaN(CellType.FLOAT32.toCellValue(Double.NaN)));
  }

  public void testIntegerCellsRoundOrDropNoData() {
    assertEquals(255.0, CellType.BYTE.toCellValue(255));
    assertEquals(3.0, CellType.INT16.toCellValue(2.6));
    assertEquals(-32768.0, CellType.INT16.toCellValue(-32768));
    assertTrue(Double.isNaN(CellType.BYTE.toCellValue(-9999)));
    assertTrue(Double.isNaN(CellType.UINT16.toCellValue(70000)));
    assertEquals(65535.0, CellType.UINT16.toCellValue(65535));
  }
}
