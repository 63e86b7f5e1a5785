/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidSTG.
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
 *
 */

package com.xilinx.rapidstg.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestFileTools {

    @Test
    public void testGetStringFromTextFile(@TempDir Path tmpPath) throws IOException {
        Path file = tmpPath.resolve("net.g");
        Files.write(file, ".model m\n.end\n".getBytes(StandardCharsets.UTF_8));
        Assertions.assertEquals(".model m\n.end\n", FileTools.getStringFromTextFile(file.toString()));
    }

    @Test
    public void testMissingFile(@TempDir Path tmpPath) {
        String missing = tmpPath.resolve("missing.g").toString();
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> FileTools.errorIfFileDoesNotExist(missing));
        Assertions.assertTrue(e.getMessage().contains(missing));
        Assertions.assertThrows(UncheckedIOException.class, () -> FileTools.getStringFromTextFile(missing));
        FileTools.errorIfFileDoesNotExist(tmpPath.toString());
    }
}
