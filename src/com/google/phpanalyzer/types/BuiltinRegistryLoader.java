/*
 * Copyright 2026 The Closure Compiler Authors.
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
package com.google.phpanalyzer.types;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.Maps;
import com.google.common.io.Resources;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds a {@link BuiltinRegistry} from two JSON tables.
 *
 * <p>The class table maps each class name to its properties:
 *
 * <pre>
 *   {"Exception": {"properties": {"message": "string", "code": "int"}}}
 * </pre>
 *
 * <p>The function table maps each fully qualified function name to its signature row. The first
 * member of a row is the return type, whatever its key; the rest are the parameters in order:
 *
 * <pre>
 *   {"\\strlen": {"return": "int", "string": "string"}}
 * </pre>
 *
 * Any problem with the tables is an {@link IllegalStateException}, since the analyzer cannot run
 * without them.
 */
public final class BuiltinRegistryLoader {
  private static final Logger logger = Logger.getLogger(BuiltinRegistryLoader.class.getName());

  static final String CLASS_TYPES_RESOURCE = "builtin_class_types.json";
  static final String FUNCTION_SIGNATURES_RESOURCE = "builtin_function_signatures.json";

  private BuiltinRegistryLoader() {}

  /** Loads the tables bundled next to this class. */
  static BuiltinRegistry loadDefault() {
    return loadResources(
        BuiltinRegistryLoader.class, CLASS_TYPES_RESOURCE, FUNCTION_SIGNATURES_RESOURCE);
  }

  /** Loads the tables from classpath resources relative to {@code contextClass}. */
  public static BuiltinRegistry loadResources(
      Class<?> contextClass, String classTypesResource, String functionSignaturesResource) {
    BuiltinRegistry.Builder builder = BuiltinRegistry.builder();
    addClasses(builder, readResource(contextClass, classTypesResource), classTypesResource);
    addFunctions(
        builder,
        readResource(contextClass, functionSignaturesResource),
        functionSignaturesResource);
    return build(builder);
  }

  /** Loads the tables from JSON text. */
  public static BuiltinRegistry load(String classTypesJson, String functionSignaturesJson) {
    BuiltinRegistry.Builder builder = BuiltinRegistry.builder();
    addClasses(builder, classTypesJson, "class types");
    addFunctions(builder, functionSignaturesJson, "function signatures");
    return build(builder);
  }

  private static BuiltinRegistry build(BuiltinRegistry.Builder builder) {
    BuiltinRegistry registry = builder.build();
    logger.info(
        "Loaded "
            + registry.getClassCount()
            + " builtin classes and "
            + registry.getFunctionCount()
            + " builtin functions");
    return registry;
  }

  private static String readResource(Class<?> contextClass, String resourceName) {
    URL url;
    try {
      url = Resources.getResource(contextClass, resourceName);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Missing builtin table " + resourceName, e);
    }
    try {
      return Resources.toString(url, UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Could not read builtin table " + resourceName, e);
    }
  }

  private static void addClasses(BuiltinRegistry.Builder builder, String json, String source) {
    for (Map.Entry<String, JsonElement> classEntry : parseObject(json, source).entrySet()) {
      String className = classEntry.getKey();
      builder.addClass(className);
      JsonElement properties =
          asObject(classEntry.getValue(), source, className).get("properties");
      if (properties == null) {
        continue;
      }
      for (Map.Entry<String, JsonElement> property :
          asObject(properties, source, className).entrySet()) {
        builder.addClassProperty(
            className,
            property.getKey(),
            asTypeString(property.getValue(), source, className + "::" + property.getKey()));
      }
    }
  }

  private static void addFunctions(BuiltinRegistry.Builder builder, String json, String source) {
    for (Map.Entry<String, JsonElement> function : parseObject(json, source).entrySet()) {
      String functionName = function.getKey();
      if (!QualifiedName.isValid(functionName)) {
        throw new IllegalStateException(
            "Bad function name '" + functionName + "' in builtin table " + source);
      }
      List<Map.Entry<String, String>> row = new ArrayList<>();
      for (Map.Entry<String, JsonElement> cell :
          asObject(function.getValue(), source, functionName).entrySet()) {
        row.add(
            Maps.immutableEntry(
                cell.getKey(),
                asTypeString(cell.getValue(), source, functionName + "/" + cell.getKey())));
      }
      builder.addFunction(functionName, FunctionSignature.fromRow(row));
    }
  }

  private static JsonObject parseObject(String json, String source) {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new IllegalStateException("Malformed builtin table " + source, e);
    }
    return asObject(root, source, "<root>");
  }

  private static JsonObject asObject(JsonElement element, String source, String where) {
    if (!element.isJsonObject()) {
      throw new IllegalStateException(
          "Expected an object at " + where + " in builtin table " + source);
    }
    return element.getAsJsonObject();
  }

  private static String asTypeString(JsonElement element, String source, String where) {
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      throw new IllegalStateException(
          "Expected a type string at " + where + " in builtin table " + source);
    }
    return element.getAsString();
  }
}
