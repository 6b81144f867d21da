/*
 * Copyright 2018 LinkedIn Corp.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package strata.utils;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;


/**
 * Layered string settings. A lookup that misses the local entries falls through to the parent,
 * so a settings file can sit on top of built-in defaults. Typed getters parse on every call. This
 * class is not threadsafe.
 */
public class Props {

  private final Map<String, String> _current;
  private final Props _parent;
  private String source = null;

  /**
   * Empty settings without a parent.
   */
  public Props() {
    this(null);
  }

  public Props(final Props parent) {
    this._current = new HashMap<>();
    this._parent = parent;
  }

  /**
   * Reads a properties file. A missing file gives empty settings.
   */
  public Props(final Props parent, final File file) throws IOException {
    this(parent);

    if (file.exists()) {
      setSource(file.getPath());

      try (final InputStream input = new BufferedInputStream(new FileInputStream(file))) {
        loadFrom(input);
      }
    }
  }

  public Props(final Props parent, final InputStream inputStream) throws IOException {
    this(parent);
    loadFrom(inputStream);
  }

  public Props(final Props parent, final Map<String, String> entries) {
    this(parent);
    if (entries != null) {
      this._current.putAll(entries);
    }
  }

  /**
   * Settings without a parent from alternating keys and values, i.e. [key1, value1, key2,
   * value2 ...]
   */
  public static Props of(final String... args) {
    return of((Props) null, args);
  }

  /**
   * Settings on top of {@code parent} from alternating keys and values.
   */
  public static Props of(final Props parent, final String... args) {
    if (args.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Must have an equal number of keys and values.");
    }

    final Map<String, String> vals = new HashMap<>(args.length / 2);
    for (int i = 0; i < args.length; i += 2) {
      vals.put(args[i], args[i + 1]);
    }
    return new Props(parent, vals);
  }

  private void loadFrom(final InputStream inputStream) throws IOException {
    final Properties properties = new Properties();
    properties.load(inputStream);
    this.put(properties);
  }

  public boolean containsKey(final Object k) {
    return this._current.containsKey(k)
        || (this._parent != null && this._parent.containsKey(k));
  }

  /**
   * @return the local value, else the parent's, else null
   */
  public String get(final Object key) {
    if (this._current.containsKey(key)) {
      return this._current.get(key);
    } else if (this._parent != null) {
      return this._parent.get(key);
    } else {
      return null;
    }
  }

  public Set<String> localKeySet() {
    return this._current.keySet();
  }

  public Props getParent() {
    return this._parent;
  }

  public String put(final String key, final String value) {
    return this._current.put(key, value);
  }

  public void put(final Properties properties) {
    for (final String propName : properties.stringPropertyNames()) {
      this._current.put(propName, properties.getProperty(propName));
    }
  }

  /**
   * @throws UndefinedPropertyException if the key is not set here or in a parent
   */
  public String getString(final String key) {
    if (!containsKey(key)) {
      throw new UndefinedPropertyException("Missing required property '" + key + "'");
    }
    return get(key);
  }

  /**
   * True only for a case-insensitive "true"; the default when the key is not set.
   */
  public boolean getBoolean(final String key, final boolean defaultValue) {
    return containsKey(key) ? "true".equalsIgnoreCase(get(key).trim()) : defaultValue;
  }

  /**
   * @throws NumberFormatException if the value is set but not a long
   */
  public long getLong(final String name, final long defaultValue) {
    return containsKey(name) ? Long.parseLong(get(name).trim()) : defaultValue;
  }

  /**
   * @throws NumberFormatException if the value is set but not an int
   */
  public int getInt(final String name, final int defaultValue) {
    return containsKey(name) ? Integer.parseInt(get(name).trim()) : defaultValue;
  }

  public int getInt(final String name) {
    return Integer.parseInt(getString(name).trim());
  }

  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    } else if (o == null || o.getClass() != Props.class) {
      return false;
    }

    final Props p = (Props) o;
    return this._current.equals(p._current) && Objects.equals(this._parent, p._parent);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this._current, this._parent);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("{");
    for (final Map.Entry<String, String> entry : this._current.entrySet()) {
      builder.append(entry.getKey()).append(": ").append(entry.getValue()).append(", ");
    }
    if (this._parent != null) {
      builder.append(" parent = ").append(this._parent);
    }
    return builder.append("}").toString();
  }

  /**
   * @return the path of the file the settings were read from, null otherwise
   */
  public String getSource() {
    return this.source;
  }

  public Props setSource(final String source) {
    this.source = source;
    return this;
  }
}
