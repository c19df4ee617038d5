/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exlc.tree;

/**
 * Position in the original source file that a node was lowered from
 */
public class FilePosition {
  public final String file;
  public final int line;
  /** Column, or 0 if unknown */
  public final int column;

  public FilePosition(String file, int line) {
    this(file, line, 0);
  }

  public FilePosition(String file, int line, int column) {
    super();
    this.file = file;
    this.line = line;
    this.column = column;
  }

  @Override
  public int hashCode() {
    int result = file == null ? 0 : file.hashCode();
    result = 31 * result + line;
    result = 31 * result + column;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FilePosition)) {
      return false;
    }
    FilePosition other = (FilePosition)obj;
    return line == other.line && column == other.column &&
        (file == null ? other.file == null : file.equals(other.file));
  }

  @Override
  public String toString() {
    return file + ":" + line + (column > 0 ? ":" + column : "");
  }
}
