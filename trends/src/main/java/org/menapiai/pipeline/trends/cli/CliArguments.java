/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.menapiai.pipeline.trends.cli;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed command line: one subcommand followed by {@code --option value}
 * pairs and boolean flags.
 *
 * <p>{@code --property-type} may be repeated; every other option may appear
 * at most once.
 */
final class CliArguments {
  static final ImmutableSet<String> COMMANDS = ImmutableSet.of(
      "ingest-housing", "transform-housing", "run-housing",
      "ingest-employment", "transform-employment", "run-employment",
      "inspect", "validate");

  static final ImmutableSet<String> VALUE_OPTIONS = ImmutableSet.of(
      "--config", "--local-path", "--city", "--state", "--start-date", "--end-date",
      "--property-type", "--metro", "--dataset", "--path", "--head");

  static final ImmutableSet<String> FLAGS = ImmutableSet.of("--force-refresh", "--help");

  private static final String REPEATABLE = "--property-type";

  private final String command;
  private final ImmutableMap<String, ImmutableList<String>> options;
  private final ImmutableSet<String> flags;

  private CliArguments(String command, Map<String, List<String>> options, List<String> flags) {
    this.command = command;
    ImmutableMap.Builder<String, ImmutableList<String>> builder = ImmutableMap.builder();
    options.forEach((name, values) -> builder.put(name, ImmutableList.copyOf(values)));
    this.options = builder.build();
    this.flags = ImmutableSet.copyOf(flags);
  }

  /**
   * Parses arguments.
   *
   * @throws UsageException on an unknown command or option, a missing
   *     option value or a repeated option
   */
  static CliArguments parse(String[] args) throws UsageException {
    if (args.length == 0) {
      throw new UsageException("No command given");
    }
    String command = args[0];
    if (!COMMANDS.contains(command)) {
      throw new UsageException("Unknown command '" + command + "'");
    }
    Map<String, List<String>> options = new LinkedHashMap<>();
    List<String> flags = new ArrayList<>();
    for (int i = 1; i < args.length; i++) {
      String arg = args[i];
      if (FLAGS.contains(arg)) {
        flags.add(arg);
      } else if (VALUE_OPTIONS.contains(arg)) {
        if (i + 1 >= args.length) {
          throw new UsageException("Option " + arg + " requires a value");
        }
        List<String> values = options.computeIfAbsent(arg, k -> new ArrayList<>());
        if (!values.isEmpty() && !REPEATABLE.equals(arg)) {
          throw new UsageException("Option " + arg + " given more than once");
        }
        values.add(args[++i]);
      } else {
        throw new UsageException("Unknown option '" + arg + "'");
      }
    }
    return new CliArguments(command, options, flags);
  }

  String getCommand() {
    return command;
  }

  boolean hasFlag(String flag) {
    return flags.contains(flag);
  }

  Optional<String> option(String name) {
    ImmutableList<String> values = options.get(name);
    return values == null ? Optional.empty() : Optional.of(values.get(0));
  }

  @Nullable String optionOrNull(String name) {
    return option(name).orElse(null);
  }

  String required(String name) throws UsageException {
    return option(name).orElseThrow(() ->
        new UsageException("Command " + command + " requires " + name));
  }

  List<String> values(String name) {
    ImmutableList<String> values = options.get(name);
    return values == null ? ImmutableList.of() : values;
  }

  int intOption(String name, int defaultValue) throws UsageException {
    Optional<String> value = option(name);
    if (!value.isPresent()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.get());
    } catch (NumberFormatException e) {
      throw new UsageException("Option " + name + " expects an integer, got '"
          + value.get() + "'");
    }
  }

  /** Invalid command line. */
  static class UsageException extends Exception {
    UsageException(String message) {
      super(message);
    }
  }
}
