package com.nekopara.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * getResults() 반환값.
 * @param list     트리의 모든 데이터 payload (전위 순회 순서, null payload 허용)
 * @param complete 모든 태스크 노드가 DONE 이면 true
 */
public record CrawlResults(List<Object> list, boolean complete) {
    public CrawlResults {
        list = Collections.unmodifiableList(new ArrayList<>(list));
    }

    /** 아직 시작하지 않은 스케줄러의 결과 */
    public static CrawlResults empty() {
        return new CrawlResults(List.of(), false);
    }
}
