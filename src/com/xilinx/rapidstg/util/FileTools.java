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

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * A collection of file handling methods shared by the RapidSTG tools.
 */
public class FileTools {

    /**
     * Reads the complete contents of a UTF-8 text file into a string.  The user is
     * cautioned not to open extremely large files with this method.
     * @param fileName Name of the text file to load.
     * @return The file contents.
     */
    public static String getStringFromTextFile(String fileName) {
        try {
            return new String(Files.readAllBytes(Paths.get(fileName)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading file: " + fileName, e);
        }
    }

    /**
     * Checks if the file exists and throws a runtime exception if not.
     * @param fileName Name of the file to check.
     */
    public static void errorIfFileDoesNotExist(String fileName) {
        File f = new File(fileName);
        if (!f.exists())
            throw new RuntimeException("ERROR: Couldn't find file: " + fileName);
    }
}
