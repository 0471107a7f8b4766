package com.gridmaze;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GridMazeApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridMazeApplication.class, args);
    }
}
