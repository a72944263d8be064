/*
 * Copyright 2026 The Hintcheck Authors
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

package org.hintcheck.impl;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.OutputStream;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

/**
 * Compiles the final code of a {@link BoundCheck} into a static method and runs it.
 *
 * <p>The method declares the variables the code expects ({@code pith_0} and the other pith
 * variables, {@code random_int}, and {@code raise_exception}) and returns false if the code throws
 * the exception that {@code raise_exception} creates.
 */
final class GeneratedCheckRunner {
  private static final String PACKAGE = "org.hintcheck.generated";
  private static final AtomicInteger nextId = new AtomicInteger();

  private final String source;
  private final Method run;

  private GeneratedCheckRunner(String source, Method run) {
    this.source = source;
    this.run = run;
  }

  /** Returns true if a system Java compiler is available. */
  static boolean canCompile() {
    return ToolProvider.getSystemJavaCompiler() != null;
  }

  /** Compiles the code of the given check; fails if the code does not compile. */
  static GeneratedCheckRunner compile(BoundCheck check) throws Exception {
    JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    Preconditions.checkState(compiler != null, "No system Java compiler");
    String className = "GeneratedCheck" + nextId.getAndIncrement();
    String source = source(className, check.code(), check.compiled.template.pithVariableCount());
    StringWriter diagnostics = new StringWriter();
    InMemoryFileManager fileManager =
        new InMemoryFileManager(compiler.getStandardFileManager(null, null, UTF_8));
    List<String> options = ImmutableList.of("-proc:none", "-classpath", classPath());
    boolean compiled =
        compiler
            .getTask(
                diagnostics,
                fileManager,
                null,
                options,
                null,
                ImmutableList.of(new SourceFile(PACKAGE + "." + className, source)))
            .call();
    if (!compiled) {
      throw new AssertionError("Generated code doesn't compile:\n" + diagnostics + "\n" + source);
    }
    ClassLoader loader =
        new GeneratedClassLoader(fileManager.classes, GeneratedCheckRunner.class.getClassLoader());
    Class<?> cls = loader.loadClass(PACKAGE + "." + className);
    return new GeneratedCheckRunner(source, cls.getMethod("run", Object.class, int.class));
  }

  /** Runs the generated code; returns false if it raised. */
  boolean run(Object pith, int randomInt) throws Exception {
    try {
      return (Boolean) run.invoke(null, pith, randomInt);
    } catch (InvocationTargetException e) {
      throw new AssertionError("Generated code threw unexpectedly:\n" + source, e.getCause());
    }
  }

  String source() {
    return source;
  }

  private static String source(String className, String code, int pithVariableCount) {
    StringBuilder sb = new StringBuilder();
    sb.append("package ").append(PACKAGE).append(";\n\n");
    sb.append("public final class ").append(className).append(" {\n");
    sb.append("  public static final class Violation extends RuntimeException {\n");
    sb.append("    Violation(String pithName) {\n");
    sb.append("      super(pithName);\n");
    sb.append("    }\n");
    sb.append("  }\n\n");
    sb.append("  public static final class Raiser {\n");
    sb.append("    public Violation violation(String pithName, Object pith) {\n");
    sb.append("      return new Violation(pithName);\n");
    sb.append("    }\n\n");
    sb.append("    public Violation violation(String pithName, Object pith, int randomInt) {\n");
    sb.append("      return new Violation(pithName);\n");
    sb.append("    }\n");
    sb.append("  }\n\n");
    sb.append("  public static boolean run(Object pith, int ")
        .append(PithNames.RANDOM_INT)
        .append(") {\n");
    sb.append("    Object ").append(PithNames.ROOT_PITH_VAR).append(" = pith;\n");
    for (int i = 1; i < pithVariableCount; i++) {
      sb.append("    Object ").append(PithNames.pithVar(i)).append(" = null;\n");
    }
    sb.append("    Raiser ").append(PithNames.RAISE_EXCEPTION).append(" = new Raiser();\n");
    sb.append("    try {\n");
    sb.append(code);
    sb.append("    } catch (Violation e) {\n");
    sb.append("      return false;\n");
    sb.append("    }\n");
    sb.append("    return true;\n");
    sb.append("  }\n");
    sb.append("}\n");
    return sb.toString();
  }

  /** The main and test class directories, followed by the rest of the class path. */
  private static String classPath() throws URISyntaxException {
    Set<String> entries = new LinkedHashSet<>();
    for (Class<?> cls : ImmutableList.of(CheckSupport.class, GeneratedCheckRunner.class)) {
      URI location = cls.getProtectionDomain().getCodeSource().getLocation().toURI();
      entries.add(Paths.get(location).toString());
    }
    entries.add(System.getProperty("java.class.path"));
    return String.join(File.pathSeparator, entries);
  }

  private static class SourceFile extends SimpleJavaFileObject {
    private final String source;

    SourceFile(String className, String source) {
      super(
          URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension),
          Kind.SOURCE);
      this.source = source;
    }

    @Override
    public CharSequence getCharContent(boolean ignoreEncodingErrors) {
      return source;
    }
  }

  private static class ClassFile extends SimpleJavaFileObject {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    ClassFile(String className) {
      super(
          URI.create("bytes:///" + className.replace('.', '/') + Kind.CLASS.extension),
          Kind.CLASS);
    }

    @Override
    public OutputStream openOutputStream() {
      return bytes;
    }
  }

  private static class InMemoryFileManager
      extends ForwardingJavaFileManager<StandardJavaFileManager> {
    final Map<String, ClassFile> classes = new HashMap<>();

    InMemoryFileManager(StandardJavaFileManager fileManager) {
      super(fileManager);
    }

    @Override
    public JavaFileObject getJavaFileForOutput(
        Location location, String className, JavaFileObject.Kind kind, FileObject sibling) {
      ClassFile file = new ClassFile(className);
      classes.put(className, file);
      return file;
    }
  }

  private static class GeneratedClassLoader extends ClassLoader {
    private final Map<String, ClassFile> classes;

    GeneratedClassLoader(Map<String, ClassFile> classes, ClassLoader parent) {
      super(parent);
      this.classes = classes;
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
      ClassFile file = classes.get(name);
      if (file == null) {
        throw new ClassNotFoundException(name);
      }
      byte[] bytes = file.bytes.toByteArray();
      return defineClass(name, bytes, 0, bytes.length);
    }
  }
}
