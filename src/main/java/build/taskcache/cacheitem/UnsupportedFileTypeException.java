// Copyright 2026 The TaskCache Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package build.taskcache.cacheitem;

import java.io.IOException;

/** An archive entry type that cannot be represented portably, such as a device, fifo or socket. */
public class UnsupportedFileTypeException extends IOException {
  private static final long serialVersionUID = 1;

  private final String path;

  public UnsupportedFileTypeException(String path, String type) {
    super(String.format("unsupported file type %s for %s", type, path));
    this.path = path;
  }

  public String getPath() {
    return path;
  }
}
