package com.wafsentinel.engine.store;

import java.util.List;

/**
 * One page of a classified bucket scan.
 *
 * @param records  decodable documents of the page
 * @param lastKey  sort key of the last hit, including undecodable ones; pass it
 *                 back to continue the scan
 * @param hitCount number of hits returned, decodable or not
 *
 * @author WAF Sentinel Team
 */
public record ClassifiedPage(List<ClassifiedRecord> records, String lastKey, int hitCount) {

    public ClassifiedPage {
        records = List.copyOf(records);
    }

    public static ClassifiedPage empty() {
        return new ClassifiedPage(List.of(), null, 0);
    }
}
