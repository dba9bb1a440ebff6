package com.trackflow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.trackflow.model.TrackStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrackDTO {
    private String id;
    private Instant createdDate;
    private String title;
    private String artist;
    private String album;
    private String genre;
    private String description;
    private List<String> tags;
    private String filename;
    private String fileUrl;
    private Long fileSize;
    private Integer duration;
    private Integer bitrate;
    private TrackStatus status;
    private String thumbnailUrl;
    private Instant promotionDate;
}
