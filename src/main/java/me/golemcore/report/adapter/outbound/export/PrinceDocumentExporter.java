/*
 * Copyright 2026 Aleksei Kuleshov
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
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.report.adapter.outbound.export;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.ExportFailedException;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.infrastructure.process.ProcessRunner;
import me.golemcore.report.port.outbound.DocumentExportPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Exports HTML to PDF with the Prince command-line renderer, feeding the
 * document on standard input.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PrinceDocumentExporter implements DocumentExportPort {

    private final ProcessRunner processRunner;
    private final ReportProperties properties;

    @Override
    public Path exportPdf(String html, Path target) {
        ReportProperties.OutputProperties output = properties.getOutput();
        List<String> command = List.of(output.getPrinceCommand(), "-", "-o", target.toString());
        Duration timeout = Duration.ofMillis(output.getExportTimeoutMs());
        try {
            ProcessRunner.ProcessOutput result = processRunner.run(command, null, html, timeout);
            if (!result.isSuccess()) {
                throw new ExportFailedException("prince exited with " + result.exitCode() + ": "
                        + result.stderr().strip());
            }
        } catch (IOException e) {
            throw new ExportFailedException("prince is not available: " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new ExportFailedException(e.getMessage(), e);
        }
        if (!Files.isRegularFile(target)) {
            throw new ExportFailedException("prince reported success but produced no file at " + target);
        }
        log.info("[Export] PDF written to {}", target);
        return target;
    }
}
