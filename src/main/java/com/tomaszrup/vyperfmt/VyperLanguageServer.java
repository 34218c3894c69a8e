////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.vyperfmt;

import com.tomaszrup.vyperfmt.format.VyperFormatter;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.logging.Level;

/**
 * Language server exposing the formatter to editors over stdio, or over a
 * loopback TCP socket with {@code --tcp [port]}.
 */
public class VyperLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(VyperLanguageServer.class);

    static final int DEFAULT_PORT = 5007;

    public static void main(String[] args) throws IOException {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
                logger.error("Uncaught exception on thread {}: {}",
                        thread.getName(), throwable.getMessage(), throwable));

        // "Unmatched cancel notification" warnings are routine
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint")
                .setLevel(Level.SEVERE);
        if (args.length > 0 && "--tcp".equals(args[0])) {
            int port = DEFAULT_PORT;
            if (args.length > 1) {
                try {
                    port = Integer.parseInt(args[1]);
                } catch (NumberFormatException e) {
                    logger.error("Invalid port number: {}", args[1]);
                    System.exit(1);
                }
            }

            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("Vyper Language Server listening on port {} (localhost only)", port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");
                    startServer(socket.getInputStream(), socket.getOutputStream());
                }
            }
        } else {
            logger.info("Vyper Language Server starting in stdio mode.");
            startServer(System.in, System.out);
        }
    }

    private static void startServer(InputStream in, OutputStream out) {
        // stdout carries the protocol
        System.setOut(new PrintStream(System.err));

        VyperLanguageServer server = new VyperLanguageServer();
        Launcher<LanguageClient> launcher = Launcher.createLauncher(server, LanguageClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final VyperServices vyperServices;

    public VyperLanguageServer() {
        this(new VyperFormatter());
    }

    public VyperLanguageServer(VyperFormatter formatter) {
        this.vyperServices = new VyperServices(formatter);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        InitializationOptionsParser.ParsedOptions options =
                InitializationOptionsParser.parse(params.getInitializationOptions());
        if (options != null) {
            if (options.lineLength != null) {
                vyperServices.setLineLength(options.lineLength);
            }
            if (options.safe != null) {
                vyperServices.setSafe(options.safe);
            }
        }

        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
        serverCapabilities.setDocumentFormattingProvider(true);
        serverCapabilities.setDocumentRangeFormattingProvider(true);

        InitializeResult initializeResult = new InitializeResult(serverCapabilities,
                new ServerInfo("vyperfmt", "0.1.0"));
        return CompletableFuture.completedFuture(initializeResult);
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        logger.info("Shutting down");
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return vyperServices;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return vyperServices;
    }

    @Override
    public void connect(LanguageClient client) {
        vyperServices.connect(client);
    }
}
