package com.mmbrief.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewsItemRow {
    private String ticker;
    private String title;
    private String publisher;
    private String link;
    private Long providerPublishTime;
    private Long createdAt;
}
