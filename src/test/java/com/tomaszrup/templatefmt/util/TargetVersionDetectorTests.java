////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.templatefmt.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetVersionDetectorTests {

    @Test
    void detectsMultiLineDependencies() {
        String manifest = "[project]\n"
                + "name = \"site\"\n"
                + "dependencies = [\n"
                + "    \"requests\",\n"
                + "    \"Django>=4.2,<5.0\",  # LTS\n"
                + "]\n";

        assertEquals(Optional.of(TargetVersion.of(4, 2)), TargetVersionDetector.detectFromManifest(manifest));
    }

    @Test
    void detectsSingleLineCompatibleRelease() {
        String manifest = "[project]\ndependencies = [\"django~=3.2.1\", 'celery']\n";

        assertEquals(Optional.of(TargetVersion.of(3, 2)), TargetVersionDetector.detectFromManifest(manifest));
    }

    @Test
    void detectsExtrasAndMarkers() {
        assertEquals(Optional.of(TargetVersion.of(5, 0)),
                TargetVersionDetector.lowerBound("Django[argon2]>=5.0"));
        assertEquals(Optional.of(TargetVersion.of(4, 0)),
                TargetVersionDetector.lowerBound("Django>=4.0; python_version >= '3.8'"));
        assertEquals(Optional.of(TargetVersion.of(4, 1)),
                TargetVersionDetector.lowerBound("django==4.1.7"));
    }

    @Test
    void requirementWithoutLowerBoundIsIgnored() {
        assertTrue(TargetVersionDetector.lowerBound("django").isEmpty());
        assertTrue(TargetVersionDetector.lowerBound("django<5").isEmpty());
    }

    @Test
    void similarlyNamedPackagesAreIgnored() {
        String manifest = "[project]\ndependencies = [\"django-extensions>=3.0\", \"Django>=3.1\"]\n";

        assertEquals(Optional.of(TargetVersion.of(3, 1)), TargetVersionDetector.detectFromManifest(manifest));
    }

    @Test
    void newerReleaseMapsToNewestSupported() {
        String manifest = "[project]\ndependencies = [\"django>=6.1\"]\n";

        assertEquals(Optional.of(TargetVersion.of(5, 2)), TargetVersionDetector.detectFromManifest(manifest));
    }

    @Test
    void olderReleaseYieldsNothing() {
        String manifest = "[project]\ndependencies = [\"django>=1.11\"]\n";

        assertTrue(TargetVersionDetector.detectFromManifest(manifest).isEmpty());
    }

    @Test
    void otherTablesAreIgnored() {
        String manifest = "[tool.poetry]\ndependencies = [\"django>=4.2\"]\n\n[project]\nname = \"x\"\n";

        assertTrue(TargetVersionDetector.detectFromManifest(manifest).isEmpty());
        assertEquals(List.of(), TargetVersionDetector.projectDependencies(manifest));
    }

    @Test
    void detectReadsManifestFromDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve(TargetVersionDetector.MANIFEST_FILE),
                "[project]\ndependencies = [\"Django>=4.1\"]\n", StandardCharsets.UTF_8);

        assertEquals(Optional.of(TargetVersion.of(4, 1)), TargetVersionDetector.detect(dir));
    }

    @Test
    void detectWithoutManifestYieldsNothing(@TempDir Path dir) {
        assertTrue(TargetVersionDetector.detect(dir).isEmpty());
        assertTrue(TargetVersionDetector.detect(null).isEmpty());
    }
}
