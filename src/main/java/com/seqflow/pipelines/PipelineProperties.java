package com.seqflow.pipelines;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "seqflow.pipelines")
public class PipelineProperties {

    private String sharedScratch = "/docker_scratch";
    private String containerScratch = "/scratch";
    private String refdbs = "/refdbs";
    private Images images = new Images();

    public String getSharedScratch() { return sharedScratch; }
    public void setSharedScratch(String sharedScratch) { this.sharedScratch = sharedScratch; }
    public String getContainerScratch() { return containerScratch; }
    public void setContainerScratch(String containerScratch) { this.containerScratch = containerScratch; }
    public String getRefdbs() { return refdbs; }
    public void setRefdbs(String refdbs) { this.refdbs = refdbs; }
    public Images getImages() { return images; }
    public void setImages(Images images) { this.images = images; }

    /**
     * Container image per tool.
     */
    public static class Images {
        private String getSra = "quay.io/fhcrc-microbiome/get_sra:v0.2";
        private String fastqp = "quay.io/fhcrc-microbiome/fastqp:v0.2";
        private String metaspades = "quay.io/fhcrc-microbiome/metaspades:v3.11.1--7";
        private String prokka = "quay.io/fhcrc-microbiome/metaspades:v3.11.1--7";
        private String integrateAssemblies = "quay.io/fhcrc-microbiome/integrate-metagenomic-assemblies:v0.4";
        private String famli = "quay.io/fhcrc-microbiome/famli:v1.1";
        private String humann2 = "quay.io/fhcrc-microbiome/humann2:v0.11.1--7";
        private String checkm = "quay.io/fhcrc-microbiome/checkm:v1.0.11";
        private String mapViruses = "quay.io/fhcrc-microbiome/map_viruses:v0.7";
        private String transfer = "quay.io/fhcrc-microbiome/python:python-v0.1";

        public String getGetSra() { return getSra; }
        public void setGetSra(String getSra) { this.getSra = getSra; }
        public String getFastqp() { return fastqp; }
        public void setFastqp(String fastqp) { this.fastqp = fastqp; }
        public String getMetaspades() { return metaspades; }
        public void setMetaspades(String metaspades) { this.metaspades = metaspades; }
        public String getProkka() { return prokka; }
        public void setProkka(String prokka) { this.prokka = prokka; }
        public String getIntegrateAssemblies() { return integrateAssemblies; }
        public void setIntegrateAssemblies(String integrateAssemblies) { this.integrateAssemblies = integrateAssemblies; }
        public String getFamli() { return famli; }
        public void setFamli(String famli) { this.famli = famli; }
        public String getHumann2() { return humann2; }
        public void setHumann2(String humann2) { this.humann2 = humann2; }
        public String getCheckm() { return checkm; }
        public void setCheckm(String checkm) { this.checkm = checkm; }
        public String getMapViruses() { return mapViruses; }
        public void setMapViruses(String mapViruses) { this.mapViruses = mapViruses; }
        public String getTransfer() { return transfer; }
        public void setTransfer(String transfer) { this.transfer = transfer; }
    }
}
