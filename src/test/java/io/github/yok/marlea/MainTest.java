package io.github.yok.marlea;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.marlea.config.MarleaConfig;
import io.github.yok.marlea.model.ReactionNetwork;
import io.github.yok.marlea.parser.CsvNetworkParser;
import io.github.yok.marlea.parser.NetworkLoader;
import io.github.yok.marlea.parser.NetworkParseException;
import io.github.yok.marlea.parser.ParseErrorKind;
import io.github.yok.marlea.util.ErrorHandler;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private MarleaConfig marleaConfig;
    private NetworkLoader networkLoader;
    private ReactionNetwork network;

    private Main main;

    private PrintStream originalOut;
    private PrintStream originalErr;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setup() throws Exception {
        marleaConfig = new MarleaConfig();
        networkLoader = mock(NetworkLoader.class);
        network = new CsvNetworkParser().parse("a => b,1,\nb,2,\n");

        main = new Main(marleaConfig, networkLoader);

        originalOut = System.out;
        originalErr = System.err;
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void run_正常ケース_sourceオプションを指定する_指定ファイルが読み込まれること() throws Exception {
        when(networkLoader.load(any())).thenReturn(network);

        main.run("--source", "networks/counter.csv");

        ArgumentCaptor<File> captor = ArgumentCaptor.forClass(File.class);
        verify(networkLoader).load(captor.capture());
        assertEquals(new File("networks/counter.csv"), captor.getValue());
        assertEquals(ErrorHandler.EXIT_OK, main.getExitCode());
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void run_正常ケース_短縮オプションとshowを指定する_ネットワークが標準出力に出力されること() throws Exception {
        when(networkLoader.load(any())).thenReturn(network);

        main.run("-s", "n.csv", "--show");

        assertEquals("a => b,1,\na,0,\nb,2,\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void run_正常ケース_設定でshowNetworkが有効_ネットワークが標準出力に出力されること() throws Exception {
        marleaConfig.setShowNetwork(true);
        when(networkLoader.load(any())).thenReturn(network);

        main.run("-s", "n.csv");

        assertTrue(out.toString(StandardCharsets.UTF_8).contains("a => b,1,"));
    }

    @Test
    void run_正常ケース_引数なし_設定のsourcePathが使われること() throws Exception {
        marleaConfig.setSourcePath("from-config.csv");
        when(networkLoader.load(any())).thenReturn(network);

        main.run("--unknown");

        verify(networkLoader).load(new File("from-config.csv"));
        assertEquals(ErrorHandler.EXIT_OK, main.getExitCode());
    }

    @Test
    void run_異常ケース_ソース未指定_nullで読み込みが呼ばれINVALID_FILEの終了コードになること() throws Exception {
        when(networkLoader.load(null)).thenThrow(
                new NetworkParseException(ParseErrorKind.INVALID_FILE, "No source file was given"));

        main.run();

        ArgumentCaptor<File> captor = ArgumentCaptor.forClass(File.class);
        verify(networkLoader).load(captor.capture());
        assertNull(captor.getValue());
        assertEquals(ErrorHandler.EXIT_INVALID_FILE, main.getExitCode());
    }

    @Test
    void run_異常ケース_構文エラー_PARSE_FAILEDの終了コードになること() throws Exception {
        when(networkLoader.load(any())).thenThrow(
                new NetworkParseException(ParseErrorKind.PARSE_FAILED, "line 1:6 extraneous"));

        main.run("--source", "broken.csv", "--show");

        assertEquals(ErrorHandler.EXIT_PARSE_FAILED, main.getExitCode());
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void run_異常ケース_sourceの値が欠落_設定値もなければnullで読み込まれること() throws Exception {
        when(networkLoader.load(any())).thenThrow(
                new NetworkParseException(ParseErrorKind.INVALID_FILE, "No source file was given"));

        main.run("--source");

        assertEquals(ErrorHandler.EXIT_INVALID_FILE, main.getExitCode());
    }
}
