package com.seqflow.pipelines;

import com.seqflow.core.command.CommandTemplate;
import com.seqflow.core.target.Target;
import com.seqflow.core.task.ContainerSpec;
import com.seqflow.core.task.Parameters;

import java.util.Map;

/**
 * Copies one file from an FTP server to a target with wget.
 */
public class TransferFtpFile extends ToolTask {

    public static final String OUT_FILE = "out_file";

    public TransferFtpFile(String name, String ftpUrl, Target destination, String image, ContainerSpec spec) {
        super(name,
                Parameters.builder().put("ftp_url", ftpUrl).build(),
                spec,
                image,
                Map.of(OUT_FILE, destination));
    }

    @Override
    public CommandTemplate command() {
        return CommandTemplate.builder("wget")
                .placeholder("-O", OUT_FILE)
                .arg("{ftp_url}")
                .build();
    }
}
