package com.scosim.simulator;

import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegLogCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RtspSimulatorApplication {

	public static void main(String[] args) {
		// Route FFmpeg messages through the logger, fatal only
		FFmpegLogCallback.set();
		avutil.av_log_set_level(avutil.AV_LOG_FATAL);

		SpringApplication.run(RtspSimulatorApplication.class, args);
	}

}
