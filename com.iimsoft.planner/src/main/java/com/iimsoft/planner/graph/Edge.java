package com.iimsoft.planner.graph;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class Edge {
    int from;
    int to;
    // 进入节点 to 的任务时长；源点出边与进汇点的边为 0
    int weight;
}
