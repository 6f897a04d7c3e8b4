package com.yizhaoqi.filevault.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Queue payload asking for the scaled copies of one image.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ThumbnailTask {
    private Long fileId;
    private Long userId;
}
