package io.github.yok.marlea.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import io.github.yok.marlea.model.Count;
import io.github.yok.marlea.model.Name;
import io.github.yok.marlea.model.ReactionNetwork;
import io.github.yok.marlea.model.Term;
import io.github.yok.marlea.parser.CsvNetworkParser;
import org.junit.jupiter.api.Test;

class NetworkFormatterTest {

    private final CsvNetworkParser parser = new CsvNetworkParser();

    @Test
    void format_正常ケース_反応と種_反応の後に名前順の種宣言が出力されること() throws Exception {
        ReactionNetwork network = parser.parse("a => b,1,\n2 a => b + b,5,\nc,10,\n");

        assertEquals("a => b,1,\n2 a => 2 b,5,\na,0,\nb,0,\nc,10,\n",
                NetworkFormatter.format(network));
    }

    @Test
    void format_正常ケース_出力を再解析する_元と等価なネットワークになること() throws Exception {
        ReactionNetwork network = parser.parse(String.join("\n",
                "# counter",
                "value + next.0 => next.1,1,",
                ",,",
                "next.1 => 3 value.done + x,0,",
                "value,3,",
                "orphan,2,",
                ""));

        assertEquals(network, parser.parse(NetworkFormatter.format(network)));
    }

    @Test
    void format_正常ケース_空のネットワーク_空文字が返ること() throws Exception {
        assertEquals("", NetworkFormatter.format(parser.parse("")));
    }

    @Test
    void formatTerm_正常ケース_係数1は省略されること() {
        assertEquals("a.b", NetworkFormatter.formatTerm(Term.of(Name.of("a.b"))));
        assertEquals("4 a.b", NetworkFormatter.formatTerm(Term.of(Name.of("a.b"), Count.of(4L))));
    }
}
