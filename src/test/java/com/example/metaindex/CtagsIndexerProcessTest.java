package com.example.metaindex;

import com.example.metaindex.testutils.CapturingProcess;
import com.example.metaindex.testutils.TestProcessRunner;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

public class CtagsIndexerProcessTest {

    @Test
    public void runsCtagsOnATemporaryCopyAndParsesTags() throws Exception {
        String output = "!_TAG_FILE_FORMAT\t2\t/extended format/\n"
                + "main\t/tmp/ctags-1.src\t3;\"\tkind:function\tline:3\tlanguage:C\n"
                + "Point\t/tmp/ctags-1.src\t1;\"\tkind:struct\tline:1\tlanguage:C\n";
        CapturingProcess cp = new CapturingProcess(output, 0);
        TestProcessRunner runner = new TestProcessRunner(cp);
        CtagsIndexer indexer = indexer(runner, new MockEnvironment());

        Optional<List<CtagsSymbol>> out = indexer.compute("c1", "struct Point {};\n\nint main() {}\n".getBytes());

        assertThat(out).contains(List.of(
                new CtagsSymbol("main", "function", 3, "C"),
                new CtagsSymbol("Point", "struct", 1, "C")));
        List<String> command = runner.getCommands().get(0);
        assertThat(command).startsWith("ctags", "--fields=+lnKz", "--sort=no", "--guess-language-eager", "-f", "-");
    }

    @Test
    public void malformedLinesAreSkipped() {
        List<CtagsSymbol> symbols = CtagsIndexer.parse("just garbage\n"
                + "\tfile\t1;\"\tkind:function\n"
                + "noline\tfile\t/^noline$/;\"\tkind:variable\n"
                + "ok\tfile\t7;\"\tf\tlanguage:Python\n");
        assertThat(symbols).containsExactly(new CtagsSymbol("ok", "f", 7, "Python"));
    }

    @Test
    public void contentsOverTheSizeLimitAreNotScanned() throws Exception {
        TestProcessRunner runner = new TestProcessRunner(new CapturingProcess("", 0));
        CtagsIndexer indexer = indexer(runner, new MockEnvironment().withProperty("indexer.ctags.max-content-size", "4"));

        assertThat(indexer.compute("big", "0123456789".getBytes())).isEmpty();
        assertThat(runner.getCommands()).isEmpty();
    }

    @Test
    public void toolConfigurationNamesTheLimit() {
        CtagsIndexer indexer = indexer(new TestProcessRunner(new CapturingProcess("", 0)),
                new MockEnvironment().withProperty("indexer.ctags.max-content-size", "1024"));
        assertThat(indexer.toolSpec().name()).isEqualTo("universal-ctags");
        assertThat(indexer.toolSpec().configuration()).containsEntry("max_content_size", 1024L);
    }

    private static CtagsIndexer indexer(TestProcessRunner runner, MockEnvironment env) {
        return new CtagsIndexer(mock(CtagsFactStore.class), mock(ObjectStorage.class), mock(ToolRegistry.class), runner, env);
    }
}
