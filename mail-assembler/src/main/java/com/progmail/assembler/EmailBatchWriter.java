package com.progmail.assembler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Collects email messages in memory and writes the batch file in one go, so
 * a run that fails part way leaves no file behind.
 */
public class EmailBatchWriter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final StringBuilder batch = new StringBuilder();
    private int messageCount = 0;

    public EmailBatchWriter(LocalDateTime createdAt) {
        batch.append("# ").append(TIMESTAMP.format(createdAt)).append("\n\n");
    }

    public void addMessage(String address, String content) {
        batch.append("<email-message>");
        batch.append("<email-address>").append(address).append("</email-address>");
        batch.append("<content>").append(content).append('\n').append("</content>");
        batch.append("</email-message>\n\n\n");
        messageCount++;
    }

    public int getMessageCount() {
        return messageCount;
    }

    public void write(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, batch.toString(), StandardCharsets.UTF_8);
    }
}
