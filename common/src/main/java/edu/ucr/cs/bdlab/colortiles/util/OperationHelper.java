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

import java.io.PrintStream;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Helper functions for command line operations
 */
public class OperationHelper {

  /**A parameter declared by an operation or one of the classes it inherits parameters from*/
  public static class ParamInfo {
    public final String name;
    public final OperationParam metadata;

    ParamInfo(String name, OperationParam metadata) {
      this.name = name;
      this.metadata = metadata;
    }
  }

  /**
   * Collects all the parameters of the given operation class. These are the static string fields annotated with
   * {@link OperationParam} in the class and in all the classes listed in {@link OperationMetadata#inheritParams()}.
   * @param opClass the operation class
   * @return the list of parameters in the order they are declared
   */
  public static List<ParamInfo> getParameters(Class<?> opClass) {
    List<ParamInfo> params = new ArrayList<>();
    Set<Class<?>> visited = new LinkedHashSet<>();
    Deque<Class<?>> toVisit = new ArrayDeque<>();
    toVisit.add(opClass);
    while (!toVisit.isEmpty()) {
      Class<?> klass = toVisit.removeFirst();
      if (!visited.add(klass))
        continue;
      for (Field field : klass.getFields()) {
        OperationParam param = field.getAnnotation(OperationParam.class);
        if (param == null || !Modifier.isStatic(field.getModifiers()) || field.getType() != String.class)
          continue;
        try {
          params.add(new ParamInfo((String) field.get(null), param));
        } catch (IllegalAccessException e) {
          throw new RuntimeException("Cannot read the parameter " + field, e);
        }
      }
      OperationMetadata metadata = klass.getAnnotation(OperationMetadata.class);
      if (metadata != null) {
        for (Class<?> inherited : metadata.inheritParams())
          toVisit.addLast(inherited);
      }
    }
    return params;
  }

  /**
   * Prints the usage of an operation annotated with {@link OperationMetadata}
   * @param opClass the operation class
   * @param out the stream to print to
   */
  public static void printUsage(Class<?> opClass, PrintStream out) {
    OperationMetadata metadata = opClass.getAnnotation(OperationMetadata.class);
    if (metadata == null)
      throw new IllegalArgumentException("Class " + opClass.getName() + " is not annotated as an operation");
    out.printf("%s - %s\n", metadata.shortName(), metadata.description());
    out.print("Usage:");
    for (String argument : metadata.arguments())
      out.printf(" <%s>", argument);
    out.println(" [options]");
    out.println("The available options are:");
    for (ParamInfo param : getParameters(opClass)) {
      out.printf("%s%s: %s", param.metadata.required() ? "* " : "  ", param.name, param.metadata.description());
      if (!param.metadata.defaultValue().isEmpty())
        out.printf(" (Default: %s)", param.metadata.defaultValue());
      out.println();
    }
  }
}
