package com.jamra.offline.catalog;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageImage {
    private int index;
    private String url;
    private Integer width;
    private Integer height;
}
