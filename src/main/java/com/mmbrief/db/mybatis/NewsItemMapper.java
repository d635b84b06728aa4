package com.mmbrief.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface NewsItemMapper {
    @Insert("INSERT INTO news_items(ticker, title, publisher, link, provider_publish_time, created_at) " +
            "VALUES(#{ticker}, #{title}, #{publisher}, #{link}, #{providerPublishTime}, #{createdAt}) " +
            "ON CONFLICT(ticker, title) DO NOTHING")
    int insertIgnore(NewsItemRow row);

    @Select("SELECT ticker, title, publisher, link, provider_publish_time, created_at " +
            "FROM news_items WHERE ticker = #{ticker} AND provider_publish_time >= #{sinceEpochSec} " +
            "ORDER BY provider_publish_time DESC, id DESC")
    List<NewsItemRow> selectRecent(@Param("ticker") String ticker, @Param("sinceEpochSec") long sinceEpochSec);
}
