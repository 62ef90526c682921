package io.netconf.confdiff.search;

import static org.assertj.core.api.Assertions.assertThat;

import io.netconf.confdiff.tree.ConfLine;
import io.netconf.confdiff.tree.ConfParser;
import io.netconf.confdiff.tree.ConfTree;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfSearchTest {

    private final ConfSearch search = new ConfSearch();
    private final ConfTree tree = new ConfParser().parse(String.join("\n",
            "hostname router1",
            "interface GigabitEthernet0/1",
            " description WAN Link",
            " ip address 192.168.1.1 255.255.255.0",
            " no shutdown",
            "interface GigabitEthernet0/2",
            " description LAN Link",
            " ip address 10.0.0.1 255.255.255.0",
            " shutdown",
            "router bgp 65000",
            " neighbor 192.168.1.2",
            "  remote-as 65001"));

    @Test
    void findsLinesByPrefixAndLevel() {
        assertThat(search.search(tree, "interface", 0)).extracting(ConfLine::text)
                .containsExactly("interface GigabitEthernet0/1", "interface GigabitEthernet0/2");
        assertThat(search.search(tree, "ip address", 1)).hasSize(2);
    }

    @Test
    void levelMustMatchExactly() {
        assertThat(search.search(tree, "interface", 1)).isEmpty();
        assertThat(search.search(tree, "remote-as", 2)).hasSize(1);
    }

    @Test
    void narrowsByParentPrefix() {
        assertThat(search.search(tree, "ip address", 1, "interface GigabitEthernet0/1"))
                .extracting(ConfLine::text)
                .containsExactly("ip address 192.168.1.1 255.255.255.0");
        assertThat(search.search(tree, "remote-as", 2, "neighbor")).hasSize(1);
        assertThat(search.search(tree, "description", 1, "router")).isEmpty();
    }

    @Test
    void linesWithoutParentNeverMatchAParentFilter() {
        assertThat(search.search(tree, "hostname", 0, "")).isEmpty();
        assertThat(search.search(tree, "hostname", 0, Optional.empty())).hasSize(1);
    }

    @Test
    void emptyPrefixMatchesEveryLineAtTheLevel() {
        assertThat(search.search(tree, "", 0)).extracting(ConfLine::firstToken)
                .containsExactly("hostname", "interface", "interface", "router");
    }

    @Test
    void prefixIsCharacterBasedAndCaseSensitive() {
        ConfTree addresses = new ConfParser().parse("ipaddresses pool\nip address 10.0.0.1\n");

        assertThat(search.search(addresses, "ip", 0)).hasSize(2);
        assertThat(search.search(addresses, "address", 0)).isEmpty();
        assertThat(search.search(tree, "Interface", 0)).isEmpty();
    }
}
