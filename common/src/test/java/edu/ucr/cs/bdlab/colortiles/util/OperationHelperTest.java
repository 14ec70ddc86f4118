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
package edu.ucr.cs.bdlab.colortiles.util;

import junit.framework.TestCase;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

public class OperationHelperTest extends TestCase {

  public static class BaseParams {
    @OperationParam(description = "The size of things", defaultValue = "10")
    public static final String Size = "size";
  }

  @OperationMetadata(shortName = "dummy", description = "Does nothing", arguments = {"input", "output"},
      inheritParams = {BaseParams.class})
  public static class DummyOperation {
    @OperationParam(description = "Be loud", required = true)
    public static final String Loud = "loud";

    public static final String NotAParam = "ignored";
  }

  public void testGetParametersIncludesInherited() {
    List<OperationHelper.ParamInfo> params = OperationHelper.getParameters(DummyOperation.class);
    assertEquals(2, params.size());
    assertEquals("loud", params.get(0).name);
    assertEquals("size", params.get(1).name);
    assertEquals("10", params.get(1).metadata.defaultValue());
  }

  public void testPrintUsage() throws Exception {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (PrintStream out = new PrintStream(baos, true, "UTF-8")) {
      OperationHelper.printUsage(DummyOperation.class, out);
    }
    String usage = baos.toString("UTF-8");
    assertTrue(usage, usage.contains("dummy - Does nothing"));
    assertTrue(usage, usage.contains("<input> <output>"));
    assertTrue(usage, usage.contains("* loud: Be loud"));
    assertTrue(usage, usage.contains("size: The size of things (Default: 10)"));
    assertFalse(usage, usage.contains("ignored"));
  }

  public void testPrintUsageOfNonOperation() {
    try {
      OperationHelper.printUsage(BaseParams.class, System.out);
      fail("Expected an exception");
    } catch (IllegalArgumentException e) {
      // Expected
    }
  }
}
