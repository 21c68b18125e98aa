package com.example.foottraffic.analysis;

/**
 * 越线方向
 * <p>
 * 按摄像头安装约定：画面中向下运动为离开，向上运动为进入。
 */
public enum CrossingDirection {
    ENTRY,
    EXIT
}
