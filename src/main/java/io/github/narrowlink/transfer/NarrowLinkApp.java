package io.github.narrowlink.transfer;

import io.github.narrowlink.transfer.core.model.FileEntry;
import io.github.narrowlink.transfer.core.net.TransferClient;
import io.github.narrowlink.transfer.core.net.TransferServer;
import io.github.narrowlink.transfer.core.protocol.FileMetadata;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.service.RetryPolicy;
import io.github.narrowlink.transfer.core.storage.LocalFileStore;
import io.github.narrowlink.transfer.core.util.TransferSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

public final class NarrowLinkApp {
    private static final Logger logger = LoggerFactory.getLogger(NarrowLinkApp.class);

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  server [port] [root]",
            "  download <host> <port> <name> [target]",
            "  upload <host> <port> <file> [remoteName]",
            "  list <host> <port>");

    private NarrowLinkApp() {
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println(USAGE);
            System.exit(2);
        }
        TransferSettings settings = TransferSettings.load();
        try {
            switch (args[0]) {
                case "server" -> runServer(settings, args);
                case "download" -> runDownload(settings, args);
                case "upload" -> runUpload(settings, args);
                case "list" -> runList(settings, args);
                default -> {
                    System.err.println(USAGE);
                    System.exit(2);
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (ProtocolException e) {
            logger.error("{} failed: {} ({})", args[0], e.getMessage(), e.kind());
            System.exit(1);
        } catch (IOException e) {
            logger.error("{} failed", args[0], e);
            System.exit(1);
        }
    }

    private static void runServer(TransferSettings settings, String[] args) throws IOException {
        if (args.length > 1) {
            settings = settings.withPort(parsePort(args[1]));
        }
        if (args.length > 2) {
            settings = settings.withStorageRoot(Path.of(args[2]));
        }
        logger.info("Starting NarrowLink server");
        TransferServer server = new TransferServer(settings, new LocalFileStore(settings.storageRoot()));
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "narrowlink-shutdown"));
        try {
            server.awaitClose();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.close();
        }
    }

    private static void runDownload(TransferSettings settings, String[] args) throws IOException {
        requireArgs(args, 4);
        String host = args[1];
        int port = parsePort(args[2]);
        String name = args[3];
        Path target = Path.of(args.length > 4 ? args[4] : name);
        FileMetadata metadata = retryPolicy(settings).execute("download " + name, () -> {
            try (TransferClient client = connect(host, port, settings)) {
                return client.download(name, target);
            }
        });
        System.out.printf("Downloaded %s (%d bytes, sha256 %s) to %s%n", metadata.getName(), metadata.getSize(),
                metadata.getDigestHex(), target.toAbsolutePath());
    }

    private static void runUpload(TransferSettings settings, String[] args) throws IOException {
        requireArgs(args, 4);
        String host = args[1];
        int port = parsePort(args[2]);
        Path file = Path.of(args[3]);
        String remoteName = args.length > 4 ? args[4] : file.getFileName().toString();
        FileMetadata metadata = retryPolicy(settings).execute("upload " + file, () -> {
            try (TransferClient client = connect(host, port, settings)) {
                return client.upload(file, remoteName);
            }
        });
        System.out.printf("Uploaded %s as %s (%d bytes, sha256 %s)%n", file, metadata.getName(),
                metadata.getSize(), metadata.getDigestHex());
    }

    private static void runList(TransferSettings settings, String[] args) throws IOException {
        requireArgs(args, 3);
        String host = args[1];
        int port = parsePort(args[2]);
        List<FileEntry> entries = retryPolicy(settings).execute("list", () -> {
            try (TransferClient client = connect(host, port, settings)) {
                return client.list();
            }
        });
        if (entries.isEmpty()) {
            System.out.println("No files available");
            return;
        }
        for (FileEntry entry : entries) {
            System.out.printf("%-40s %12d  %s%n", entry.name(), entry.size(),
                    Instant.ofEpochMilli(entry.modifiedMillis()));
        }
    }

    private static TransferClient connect(String host, int port, TransferSettings settings) throws IOException {
        return TransferClient.connect(host, port, settings, settings.defaultChunkSize(),
                settings.compressionAvailable());
    }

    private static RetryPolicy retryPolicy(TransferSettings settings) {
        return new RetryPolicy(settings.retryAttempts(), settings.retryBackoff());
    }

    private static void requireArgs(String[] args, int count) {
        if (args.length < count) {
            throw new IllegalArgumentException("Missing arguments for " + args[0]);
        }
    }

    private static int parsePort(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + text, e);
        }
    }
}
