/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.jsci.common.config;

import java.net.URL;

import org.jsci.common.exceptions.JsciRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Configuration for jsci write streams and parsers. Values come from, in
 * increasing order of precedence:
 * <ol>
 * <li>the bundled defaults file ({@value #DEFAULTS_FILE_NAME}),</li>
 * <li>the user's configuration file ({@value #CONFIG_FILE_NAME}) if present
 * on the class path,</li>
 * <li>system properties, such as {@code -Djsci.writer.indent=4}.</li>
 * </ol>
 */
public class JsciConfig {
  private static final Logger logger = LoggerFactory.getLogger(JsciConfig.class);

  public static final String DEFAULTS_FILE_NAME = "jsci-default.conf";
  public static final String CONFIG_FILE_NAME = "jsci.conf";

  public static final String JSCI_PARENT = "jsci";
  public static final String WRITER_PARENT = append(JSCI_PARENT, "writer");
  public static final String PARSER_PARENT = append(JSCI_PARENT, "parser");

  public static final String WRITER_INDENT = append(WRITER_PARENT, "indent");
  public static final String PARSER_ALLOW_COMMENTS = append(PARSER_PARENT, "allow-comments");
  public static final String PARSER_ALLOW_NAN_INF = append(PARSER_PARENT, "allow-nan-inf");

  private final Config config;

  private JsciConfig(Config config) {
    this.config = config;
  }

  public static String append(String parent, String key) {
    return parent + "." + key;
  }

  public static JsciConfig load() {
    return create(ConfigFactory.empty());
  }

  /**
   * Build a configuration with the given overrides taking precedence over
   * the user file and the defaults. Mostly for tests.
   */
  public static JsciConfig create(Config overrides) {

    // 1. Defaults, at the root of the class path.

    URL url = JsciConfig.class.getClassLoader().getResource(DEFAULTS_FILE_NAME);
    Config config = ConfigFactory.empty();
    if (url != null) {
      config = ConfigFactory.parseURL(url);
    } else {
      logger.warn("Default configuration {} not found on the class path", DEFAULTS_FILE_NAME);
    }

    // 2. User's configuration, with system properties layered on top.

    config = ConfigFactory.load(CONFIG_FILE_NAME).withFallback(config);

    // 3. Explicit overrides.

    config = overrides.withFallback(config).resolve();
    JsciConfig jsciConfig = new JsciConfig(config);
    jsciConfig.validate();
    logger.debug("Loaded jsci configuration: indent={}", jsciConfig.writerIndent());
    return jsciConfig;
  }

  private void validate() {
    if (writerIndent() < 0) {
      throw new JsciRuntimeException(WRITER_INDENT + " must not be negative: " + writerIndent());
    }
  }

  public Config getConfig() { return config; }

  public int writerIndent() {
    return getInt(WRITER_INDENT);
  }

  public boolean allowComments() {
    return getBoolean(PARSER_ALLOW_COMMENTS);
  }

  public boolean allowNanInf() {
    return getBoolean(PARSER_ALLOW_NAN_INF);
  }

  public int getInt(String key) {
    try {
      return config.getInt(key);
    } catch (ConfigException e) {
      throw new JsciRuntimeException("Invalid or missing configuration value: " + key, e);
    }
  }

  public boolean getBoolean(String key) {
    try {
      return config.getBoolean(key);
    } catch (ConfigException e) {
      throw new JsciRuntimeException("Invalid or missing configuration value: " + key, e);
    }
  }
}
