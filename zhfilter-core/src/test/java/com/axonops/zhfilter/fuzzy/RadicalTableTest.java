/*
 * Copyright 2025 AxonOps
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
 */

package com.axonops.zhfilter.fuzzy;

import com.axonops.zhfilter.api.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RadicalTableTest {

    private static InputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testDefaultTableLoads() {
        RadicalTable table = RadicalTable.loadDefault();

        assertThat(table.size()).isGreaterThan(50);
        assertThat(table.keys("她")).containsExactly("女也");
        assertThat(table.keys("的")).containsExactly("白勺");
        assertThat(table.keys("森")).containsExactly("木木木", "木林");
        assertThat(table.keys("a")).isEmpty();
    }

    @Test
    void testDefaultTableCoverageIsLimitedAndExtensible() {
        RadicalTable bundled = RadicalTable.loadDefault();

        assertThat(bundled.size()).isLessThan(200);
        assertThat(bundled.keys("鑫")).isEmpty();

        RadicalTable wider = RadicalTable.of(Map.of("鑫", List.of("金金金")));
        assertThat(wider.keys("鑫")).containsExactly("金金金");
        assertThat(new RadicalIndex(List.of("鑫"), wider).expand("金金金"))
            .extracting(Candidate::text)
            .containsExactly("鑫");
    }

    @Test
    void testLoadSkipsCommentsBlankAndMalformedLines() {
        String content = String.join("\n",
            "# comment",
            "",
            "她\t女也",
            "no tab here",
            "ab\t女也",
            "他\t亻",
            "妈\t女马",
            "妈\t女马 马女");

        RadicalTable table = RadicalTable.load(stream(content));

        assertThat(table.characters()).containsExactly("她", "妈");
        assertThat(table.keys("妈")).containsExactly("女马", "马女");
    }

    @Test
    void testLoadWrapsReadFailure() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }
        };

        assertThatThrownBy(() -> RadicalTable.load(broken))
            .isInstanceOf(UncheckedIOException.class)
            .hasRootCauseMessage("disk gone");
    }

    @Test
    void testOfCopiesAndDeduplicates() {
        Map<String, List<String>> entries = new LinkedHashMap<>();
        entries.put("她", List.of("女也", "女也"));

        RadicalTable table = RadicalTable.of(entries);
        entries.put("他", List.of("亻也"));

        assertThat(table.keys("她")).containsExactly("女也");
        assertThat(table.characters()).containsExactly("她");
    }

    @Test
    void testOfRejectsInvalidEntries() {
        assertThatThrownBy(() -> RadicalTable.of(Map.of("她的", List.of("女也"))))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("one character");
        assertThatThrownBy(() -> RadicalTable.of(Map.of("她", List.of("女"))))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("at least two components");
    }

    @Test
    void testEmptyTable() {
        assertThat(RadicalTable.empty().size()).isZero();
        assertThat(RadicalTable.empty().keys("她")).isEmpty();
    }
}
