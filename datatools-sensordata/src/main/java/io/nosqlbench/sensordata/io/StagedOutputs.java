package io.nosqlbench.sensordata.io;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/// Collects output files in temporary siblings and moves them into place together.
///
/// Nothing appears under a target name until [#commit()] runs, so a run that fails while
/// producing its outputs leaves no partial files behind. Closing without a commit removes the
/// staged files.
///
/// Targets are replaced one at a time. Replaced files are kept as backups until every move has
/// succeeded, and a failed move restores them, so a failing commit leaves the previous outputs
/// in place. A crash of the process in the middle of a commit can still leave a mix.
///
/// Staged files get the same permissions a plain [Files#createFile] would give them, or the
/// permissions of the file they replace.
///
/// ```
/// try (StagedOutputs outputs = new StagedOutputs(force)) {
///     outputs.stage(dir.resolve("final.csv"), tmp -> writer.write(table, tmp));
///     outputs.commit();
/// }
/// ```
public class StagedOutputs implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(StagedOutputs.class);

    /// Writes content to the given temporary path.
    @FunctionalInterface
    public interface OutputWriter {
        void writeTo(Path temporary) throws IOException;
    }

    private final boolean replaceExisting;
    private final Map<Path, Path> staged = new LinkedHashMap<>();
    private boolean committed;

    /// @param replaceExisting
    ///     whether existing target files may be overwritten
    public StagedOutputs(boolean replaceExisting) {
        this.replaceExisting = replaceExisting;
    }

    /// Write one output to a temporary file next to its target.
    ///
    /// @throws FileAlreadyExistsException
    ///     if the target exists and replacement is not allowed
    public void stage(Path target, OutputWriter writer) throws IOException {
        if (committed) {
            throw new IllegalStateException("Outputs have already been committed");
        }
        if (staged.containsKey(target)) {
            throw new IllegalArgumentException("Output " + target + " is staged twice");
        }
        if (!replaceExisting && Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString(), null, "use --force to overwrite");
        }
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temporary = createSibling(parent, target.getFileName().toString(), ".tmp");
        staged.put(target, temporary);
        writer.writeTo(temporary);
    }

    /// Move all staged files to their targets.
    ///
    /// @return the target paths, in staging order
    /// @throws IOException
    ///     if a move fails, after the targets replaced so far have been restored
    public List<Path> commit() throws IOException {
        if (committed) {
            throw new IllegalStateException("Outputs have already been committed");
        }
        if (!replaceExisting) {
            for (Path target : staged.keySet()) {
                if (Files.exists(target)) {
                    throw new FileAlreadyExistsException(target.toString(), null, "use --force to overwrite");
                }
            }
        }
        Deque<Replacement> applied = new ArrayDeque<>();
        try {
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                applied.push(replace(entry.getValue(), entry.getKey()));
                logger.debug("Wrote {}", entry.getKey());
            }
        } catch (IOException e) {
            rollback(applied, e);
            throw e;
        }
        committed = true;

        List<Path> written = new ArrayList<>(staged.size());
        for (Replacement replacement : applied) {
            written.add(0, replacement.target);
            if (replacement.backup != null) {
                try {
                    Files.deleteIfExists(replacement.backup);
                } catch (IOException e) {
                    logger.warn("Could not remove backup {}: {}", replacement.backup, e.getMessage());
                }
            }
        }
        return written;
    }

    private static final class Replacement {
        private final Path target;
        private Path backup;

        private Replacement(Path target) {
            this.target = target;
        }
    }

    private static Replacement replace(Path temporary, Path target) throws IOException {
        Replacement replacement = new Replacement(target);
        if (Files.exists(target)) {
            copyPermissions(target, temporary);
            Path backup = createSibling(target.toAbsolutePath().getParent(), target.getFileName().toString(), ".bak");
            try {
                move(target, backup);
            } catch (IOException e) {
                Files.deleteIfExists(backup);
                throw e;
            }
            replacement.backup = backup;
        }
        try {
            move(temporary, target);
        } catch (IOException e) {
            if (replacement.backup != null) {
                move(replacement.backup, target);
            }
            throw e;
        }
        return replacement;
    }

    private static void rollback(Deque<Replacement> applied, IOException cause) {
        for (Replacement replacement : applied) {
            try {
                if (replacement.backup != null) {
                    move(replacement.backup, replacement.target);
                } else {
                    Files.deleteIfExists(replacement.target);
                }
            } catch (IOException e) {
                logger.error("Could not restore {}: {}", replacement.target, e.getMessage());
                cause.addSuppressed(e);
            }
        }
        applied.clear();
    }

    private static Path createSibling(Path parent, String name, String suffix) throws IOException {
        for (int attempt = 0; ; attempt++) {
            Path candidate = parent.resolve("." + name + "." + Long.toUnsignedString(
                ThreadLocalRandom.current().nextLong(), 36) + suffix);
            try {
                return Files.createFile(candidate);
            } catch (FileAlreadyExistsException e) {
                if (attempt >= 16) {
                    throw e;
                }
            }
        }
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        PosixFileAttributeView source = Files.getFileAttributeView(from, PosixFileAttributeView.class);
        PosixFileAttributeView destination = Files.getFileAttributeView(to, PosixFileAttributeView.class);
        if (source != null && destination != null) {
            destination.setPermissions(source.readAttributes().permissions());
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void close() throws IOException {
        if (committed) {
            return;
        }
        IOException failure = null;
        for (Path temporary : staged.values()) {
            try {
                Files.deleteIfExists(temporary);
            } catch (IOException e) {
                logger.warn("Could not remove staged file {}: {}", temporary, e.getMessage());
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        staged.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
