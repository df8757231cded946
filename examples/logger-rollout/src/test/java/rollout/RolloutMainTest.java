package rollout;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RolloutMain")
class RolloutMainTest {

    private static final String HANDLER = """
            package grpc

            import (
            \t"context"

            \t"google.golang.org/grpc/codes"
            \t"google.golang.org/grpc/status"
            )

            type FXHandler struct {
            \tpb.UnimplementedFXServiceServer
            \tsvc *app.Service
            }

            func NewFXHandler(svc *app.Service) *FXHandler {
            \treturn &FXHandler{svc: svc}
            }

            func (h *FXHandler) Convert(ctx context.Context, req *pb.ConvertRequest) (*pb.ConvertResponse, error) {
            \tres, err := h.svc.Convert(ctx, req.From)
            \tif err != nil {
            \t\t// TODO: log original error server-side: err
            \t\treturn nil, status.Error(codes.Internal, "internal error")
            \t}
            \treturn res, nil
            }
            """;

    private static final String MAIN = """
            package main

            func main() {
            \tlogger := slog.New(slog.NewJSONHandler(os.Stdout, nil))
            \tsvc := app.NewService(repo)
            \thandler := grpcpresentation.NewFXHandler(svc)
            \tadmin := grpcpresentation.NewFXHandler(svc, logger.With("role", "admin"))
            \t_, _ = handler, admin
            }
            """;

    private static final String TEST = """
            package fxservice

            import (
            \t"context"
            \t"testing"
            )

            func TestConvert(t *testing.T) {
            \th := grpc.NewFXHandler(newTestService())
            \tquiet := grpc.NewFXHandler(newTestService(), slog.Default())
            \t_ = quiet
            \t_, _ = h.Convert(context.Background(), nil)
            }
            """;

    private static final String COMPOSE = """
            services:
              fx-service:
                healthcheck:
                  test: ["CMD", "wget", "-qO-", "http://localhost:8080/healthz"]
                  interval: 10s
                  timeout: 5s
            """;

    @TempDir
    Path root;

    private Path handler;
    private Path main;
    private Path test;
    private Path compose;

    @BeforeEach
    void setUp() throws IOException {
        handler = write("services/fx-service/internal/presentation/grpc/handler.go", HANDLER);
        main = write("services/fx-service/cmd/fx/main.go", MAIN);
        test = write("services/fx-service/handler_test.go", TEST);
        compose = write("docker-compose.yml", COMPOSE);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("should wire the logger through handlers, mains, tests and compose")
    void rollsOut() throws Exception {
        RolloutMain.rollout(root, false);

        assertThat(Files.readString(handler))
                .contains("\t\"context\"\n\t\"log/slog\"\n")
                .contains("\tsvc *app.Service\n\tlogger *slog.Logger\n}")
                .contains("func NewFXHandler(svc *app.Service, logger *slog.Logger) *FXHandler {")
                .contains("return &FXHandler{svc: svc, logger: logger}")
                .contains("\t\th.logger.Error(\"handler error\", \"error\", err)\n\t\treturn nil, status.Error(")
                .doesNotContain("TODO");
        assertThat(Files.readString(main))
                .contains("grpcpresentation.NewFXHandler(svc, logger)")
                .contains("grpcpresentation.NewFXHandler(svc, logger.With(\"role\", \"admin\"))\n");
        assertThat(Files.readString(test))
                .contains("\t\"testing\"\n\t\"log/slog\"\n")
                .contains("grpc.NewFXHandler(newTestService(), logger)")
                .contains("grpc.NewFXHandler(newTestService(), slog.Default())\n");
        assertThat(Files.readString(compose)).contains("interval: 10s\n      start_period: 30s\n");
    }

    @Test
    @DisplayName("should change nothing when run again")
    void secondRun() throws Exception {
        RolloutMain.rollout(root, false);
        String[] first = {Files.readString(handler), Files.readString(main), Files.readString(test), Files.readString(compose)};

        RolloutMain.rollout(root, false);

        assertThat(new String[]{Files.readString(handler), Files.readString(main), Files.readString(test), Files.readString(compose)})
                .containsExactly(first);
    }

    @Test
    @DisplayName("should leave the checkout untouched in a dry run")
    void dryRun() throws Exception {
        RolloutMain.rollout(root, true);

        assertThat(Files.readString(handler)).isEqualTo(HANDLER);
        assertThat(Files.readString(main)).isEqualTo(MAIN);
        assertThat(Files.readString(test)).isEqualTo(TEST);
        assertThat(Files.readString(compose)).isEqualTo(COMPOSE);
    }
}
