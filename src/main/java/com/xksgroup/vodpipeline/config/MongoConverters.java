package com.xksgroup.vodpipeline.config;

import com.xksgroup.vodpipeline.model.VideoStatus;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * Statuses are stored in their lowercase wire form; upper-case enum names are still read.
 */
@Configuration
public class MongoConverters {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(
                new VideoStatusToStringConverter(),
                new StringToVideoStatusConverter()));
    }

    @WritingConverter
    static class VideoStatusToStringConverter implements Converter<VideoStatus, String> {
        @Override
        public String convert(VideoStatus source) {
            return source.wireName();
        }
    }

    @ReadingConverter
    static class StringToVideoStatusConverter implements Converter<String, VideoStatus> {
        @Override
        public VideoStatus convert(String source) {
            return VideoStatus.fromWireName(source);
        }
    }
}
